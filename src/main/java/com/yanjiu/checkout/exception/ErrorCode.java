package com.yanjiu.checkout.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 错误码
 * 每个错误码携带HTTP状态码与默认提示信息，由 GlobalExceptionHandler 统一转换为响应
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── 通用 ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "请求参数不合法"),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "服务器错误，请稍后重试"),

    // ── 下单 ──
    PAYMENT_NOT_CONFIGURED(HttpStatus.INTERNAL_SERVER_ERROR, "支付配置缺失"),
    ORDER_NO_EXHAUSTED(HttpStatus.SERVICE_UNAVAILABLE, "创建订单失败，请稍后重试"),

    // ── 订单状态 ──
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "订单不存在"),
    ORDER_NOT_PAID(HttpStatus.PAYMENT_REQUIRED, "订单尚未完成支付，请先支付"),
    ORDER_ALREADY_CONSUMED(HttpStatus.CONFLICT, "该订单已使用，每次支付仅可分析一次"),

    // ── 分析 ──
    ANALYSIS_NOT_CONFIGURED(HttpStatus.INTERNAL_SERVER_ERROR, "服务端未配置分析服务密钥"),
    ANALYSIS_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "分析失败，请稍后重试"),
    ANALYSIS_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "AI 分析超时，请稍后重试");

    private final HttpStatus status;
    private final String message;
}
