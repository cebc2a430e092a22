package com.yanjiu.checkout.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 幂等性凭证工具类
 * - 使用Redis记录已处理的业务操作，作为重复回调的快速判断
 * - 只是加速手段：真正的并发控制由订单表的条件更新保证
 * - 未配置Redis或Redis不可用时降级为"未处理过"，流程继续走数据库判断
 */
@Slf4j
@Component
public class IdempotentUtil {

    private static final String IDEMPOTENT_KEY_PREFIX = "idempotent:";
    // 默认过期时间（秒）
    private static final long DEFAULT_EXPIRE_TIME = 24 * 3600;

    private final StringRedisTemplate redisTemplate;

    public IdempotentUtil(@Autowired(required = false) StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * 检查操作是否已执行过
     *
     * @param businessId 业务ID（商户订单号）
     * @param operationType 操作类型（如 PAY_NOTIFY）
     * @return true: 已执行过；false: 未执行过或无法判断
     */
    public boolean isOperated(String businessId, String operationType) {
        if (redisTemplate == null) {
            return false;
        }
        String key = buildKey(businessId, operationType);
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (RuntimeException e) {
            log.warn("[幂等凭证查询失败] key={}, error={}，降级为数据库判断", key, e.getMessage());
            return false;
        }
    }

    /**
     * 标记操作已执行
     *
     * @param businessId 业务ID
     * @param operationType 操作类型
     * @return true: 标记成功；false: 已存在或无法标记
     */
    public boolean markAsOperated(String businessId, String operationType) {
        if (redisTemplate == null) {
            return false;
        }
        String key = buildKey(businessId, operationType);
        try {
            // setIfAbsent 保证只有第一次标记成功
            Boolean success = redisTemplate.opsForValue().setIfAbsent(
                    key,
                    String.valueOf(System.currentTimeMillis()),
                    DEFAULT_EXPIRE_TIME,
                    TimeUnit.SECONDS
            );
            return Boolean.TRUE.equals(success);
        } catch (RuntimeException e) {
            log.warn("[幂等凭证写入失败] key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    private String buildKey(String businessId, String operationType) {
        return IDEMPOTENT_KEY_PREFIX + operationType + ":" + businessId;
    }
}
