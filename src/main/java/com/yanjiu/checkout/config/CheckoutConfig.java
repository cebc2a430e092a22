package com.yanjiu.checkout.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties({PaymentProperties.class, AnalysisProperties.class})
public class CheckoutConfig {

    /**
     * 订单号时间前缀使用的时钟，时区默认东八区
     */
    @Bean
    public Clock clock(@Value("${checkout.time-zone:Asia/Shanghai}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
