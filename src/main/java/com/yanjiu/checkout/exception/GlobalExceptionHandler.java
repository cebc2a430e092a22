package com.yanjiu.checkout.exception;

import com.yanjiu.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理
 * 统一输出 {success:false, error} 格式；回调接口自行返回纯文本，不经过这里
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[业务异常] code={}, message={}, traceId={}",
                    errorCode, e.getMessage(), TraceIdUtil.getTraceId(), e);
        } else {
            log.warn("[业务异常] code={}, message={}, traceId={}",
                    errorCode, e.getMessage(), TraceIdUtil.getTraceId());
        }
        return error(errorCode.getStatus(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.warn("[请求格式错误] error={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId());
        return error(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessException(DataAccessException e) {
        log.error("[存储异常] error={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId(), e);
        return error(ErrorCode.STORAGE_ERROR.getStatus(), ErrorCode.STORAGE_ERROR.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
