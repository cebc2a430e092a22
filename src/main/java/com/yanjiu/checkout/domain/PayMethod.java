package com.yanjiu.checkout.domain;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 支付方式，取值与支付平台的 type 参数一致
 */
public enum PayMethod {

    ALIPAY("alipay"),

    WXPAY("wxpay");

    @EnumValue
    private final String code;

    PayMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 按平台取值解析支付方式
     *
     * @param code 平台取值（alipay / wxpay）
     * @return 支付方式，无法识别时返回null
     */
    public static PayMethod fromCode(String code) {
        for (PayMethod method : values()) {
            if (method.code.equals(code)) {
                return method;
            }
        }
        return null;
    }
}
