package com.yanjiu.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 状态流转时随状态一并写入的附加字段，为null的字段不更新
 */
@Value
@Builder
public class TransitionFields {

    public static final TransitionFields NONE = TransitionFields.builder().build();

    String providerTradeNo;

    String providerStatusText;

    PayMethod payMethod;

    /**
     * 供SQL引用的支付方式取值
     */
    public String getPayMethodCode() {
        return payMethod == null ? null : payMethod.getCode();
    }
}
