package com.yanjiu.checkout.business;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 支付通知处理结果
 * 平台只认纯文本 "success"，其余任何响应都会被视为失败并重试
 */
@Getter
@RequiredArgsConstructor
public enum NotifyOutcome {

    /**
     * 已处理（含非成功状态通知、重复通知），平台停止重试
     */
    SUCCESS(HttpStatus.OK, "success", "支付确认成功"),

    SIGN_ERROR(HttpStatus.BAD_REQUEST, "sign error", "签名验证失败"),

    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "order not found", "订单不存在"),

    AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST, "amount mismatch", "金额不匹配"),

    /**
     * 配置缺失或存储异常，平台稍后重试
     */
    ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "error", "服务器错误，请稍后重试");

    private final HttpStatus status;

    /**
     * 返回给平台的应答文本
     */
    private final String token;

    /**
     * 返回给前端的提示信息
     */
    private final String message;

    public boolean isAcknowledged() {
        return this == SUCCESS;
    }
}
