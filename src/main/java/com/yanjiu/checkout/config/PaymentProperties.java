package com.yanjiu.checkout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * 支付平台配置（checkout.zpay.*）
 * 由环境变量覆盖：ZPAY_PID、ZPAY_KEY、APP_BASE_URL
 */
@Data
@ConfigurationProperties(prefix = "checkout.zpay")
public class PaymentProperties {

    /**
     * 商户ID
     */
    private String pid;

    /**
     * 商户密钥（签名用，禁止打印）
     */
    private String key;

    /**
     * 本站对外地址，用于拼接回调地址与回跳地址
     */
    private String baseUrl;

    /**
     * 平台下单跳转地址
     */
    private String submitUrl = "https://zpayz.cn/submit.php";

    /**
     * 商品名称
     */
    private String productName = "颜究院颜值分析";

    /**
     * 固定价格（人民币元）
     */
    private BigDecimal amount = new BigDecimal("0.50");

    /**
     * 订单号冲突时的最大生成次数
     */
    private int maxCreateAttempts = 3;

    /**
     * 商户ID、密钥、本站地址是否均已配置
     */
    public boolean isConfigured() {
        return hasText(pid) && hasText(key) && hasText(baseUrl);
    }

    public String notifyUrl() {
        return stripTrailingSlash(baseUrl) + "/api/checkout/providers/zpay/webhook";
    }

    public String returnUrl() {
        return stripTrailingSlash(baseUrl);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
