package com.yanjiu.checkout.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class OrderNoGeneratorTest {

    // 2026-02-19 23:15:05 东八区
    private final Clock clock = Clock.fixed(Instant.parse("2026-02-19T15:15:05Z"), ZoneId.of("Asia/Shanghai"));

    private final OrderNoGenerator generator = new OrderNoGenerator(clock);

    @Test
    @DisplayName("订单号为本地时间戳加3位随机数")
    void nextUsesLocalTimestampPrefix() {
        String orderNo = generator.next();

        assertThat(orderNo).hasSize(17).matches("\\d{17}").startsWith("20260219231505");
        int suffix = Integer.parseInt(orderNo.substring(14));
        assertThat(suffix).isBetween(100, 999);
    }

    @Test
    @DisplayName("同一秒内生成的订单号前缀相同")
    void sameSecondSharesPrefix() {
        for (int i = 0; i < 50; i++) {
            assertThat(generator.next()).matches("20260219231505[1-9]\\d{2}");
        }
    }
}
