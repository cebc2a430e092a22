package com.yanjiu.checkout.business;

import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.OrderStatus;
import com.yanjiu.checkout.domain.TransitionFields;
import com.yanjiu.checkout.exception.BusinessException;
import com.yanjiu.checkout.exception.ErrorCode;
import com.yanjiu.checkout.service.IOrderService;
import com.yanjiu.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 分析闸门：在执行付费分析前消费已支付订单
 * 通过条件更新 PAID → ANALYZED 保证同一笔支付最多被消费一次，并发请求中只有一个能通过
 */
@Slf4j
@Service
public class AnalysisGate {

    private final IOrderService orderService;

    public AnalysisGate(IOrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * 消费订单的分析额度
     *
     * @param orderNo 商户订单号
     * @return 流转前读取的订单快照
     * @throws BusinessException ORDER_NOT_FOUND / ORDER_ALREADY_CONSUMED / ORDER_NOT_PAID
     */
    public Order consumeForAnalysis(String orderNo) {
        Order snapshot = orderService.getByOrderNo(orderNo)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "订单不存在，请重新支付"));

        if (snapshot.getStatus() == OrderStatus.ANALYZED) {
            log.warn("[分析闸门] 订单已使用, orderNo={}, clientId={}", orderNo, snapshot.getClientId());
            throw new BusinessException(ErrorCode.ORDER_ALREADY_CONSUMED);
        }
        if (snapshot.getStatus() != OrderStatus.PAID) {
            log.info("[分析闸门] 订单未支付, orderNo={}, status={}", orderNo, snapshot.getStatus());
            throw new BusinessException(ErrorCode.ORDER_NOT_PAID);
        }

        boolean applied = orderService.compareAndTransition(
                orderNo, OrderStatus.PAID, OrderStatus.ANALYZED, TransitionFields.NONE);
        if (!applied) {
            log.warn("[分析闸门] 并发请求已消费该订单, orderNo={}, traceId={}", orderNo, TraceIdUtil.getTraceId());
            throw new BusinessException(ErrorCode.ORDER_ALREADY_CONSUMED);
        }

        log.info("[分析闸门] 订单已消费, orderNo={}, clientId={}, traceId={}",
                orderNo, snapshot.getClientId(), TraceIdUtil.getTraceId());
        return snapshot;
    }
}
