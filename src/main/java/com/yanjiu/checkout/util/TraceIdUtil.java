package com.yanjiu.checkout.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 链路追踪工具类
 * - 生成唯一的追踪ID
 * - 追踪ID同时写入MDC，日志格式中以 %X{traceId} 输出
 */
public final class TraceIdUtil {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    /**
     * 生成新的追踪ID
     */
    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    /**
     * 获取当前的追踪ID，未设置时返回null
     */
    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    /**
     * 清除追踪ID（请求结束时调用）
     */
    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
        MDC.remove(MDC_KEY);
    }
}
