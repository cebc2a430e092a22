package com.yanjiu.checkout.exception;

import lombok.Getter;

/**
 * 商户订单号冲突（唯一约束拦截）
 * 由下单流程内部重试，重试耗尽后才以 ORDER_NO_EXHAUSTED 暴露给调用方
 */
@Getter
public class DuplicateOrderNoException extends RuntimeException {

    private final String orderNo;

    public DuplicateOrderNoException(String orderNo, Throwable cause) {
        super("商户订单号已存在: " + orderNo, cause);
        this.orderNo = orderNo;
    }
}
