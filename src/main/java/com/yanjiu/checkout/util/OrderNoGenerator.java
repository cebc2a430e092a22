package com.yanjiu.checkout.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 商户订单号生成器
 * 格式：yyyyMMddHHmmss + 3位随机数，例：20260219231505342
 *
 * 同一秒内有 1/900 的冲突概率，冲突由订单表唯一约束拦截，下单流程负责重新生成
 */
@Slf4j
@Component
public class OrderNoGenerator {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;

    public OrderNoGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        int suffix = ThreadLocalRandom.current().nextInt(100, 1000);
        String orderNo = timestamp + suffix;
        log.debug("[生成订单号] orderNo={}", orderNo);
        return orderNo;
    }
}
