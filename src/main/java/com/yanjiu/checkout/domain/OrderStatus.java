package com.yanjiu.checkout.domain;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 订单状态
 *
 * 状态只能单向流转：PENDING → PAID → ANALYZED，不允许跳跃或回退
 */
public enum OrderStatus {

    /**
     * 已创建，等待用户支付
     */
    PENDING("pending"),

    /**
     * 回调确认已支付，等待分析
     */
    PAID("paid"),

    /**
     * 分析额度已消费（每笔支付仅允许分析一次）
     */
    ANALYZED("analyzed");

    @EnumValue
    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否允许从当前状态直接流转到目标状态
     */
    public boolean canTransitTo(OrderStatus next) {
        return next != null && next.ordinal() == this.ordinal() + 1;
    }
}
