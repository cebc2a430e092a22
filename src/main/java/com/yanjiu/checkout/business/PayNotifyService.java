package com.yanjiu.checkout.business;

import com.yanjiu.checkout.config.PaymentProperties;
import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.OrderStatus;
import com.yanjiu.checkout.domain.PayMethod;
import com.yanjiu.checkout.domain.TransitionFields;
import com.yanjiu.checkout.service.IOrderService;
import com.yanjiu.checkout.util.IdempotentUtil;
import com.yanjiu.checkout.util.SignUtil;
import com.yanjiu.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * 支付结果通知处理
 * <p>
 * 平台会重复投递通知直到收到 "success"，且可能有人伪造通知，因此：
 * 1. 先验签，验签失败不做任何修改
 * 2. 非成功状态直接应答 success，避免平台重试
 * 3. 订单不存在、金额不一致视为可疑请求，拒绝
 * 4. 订单已不是 PENDING 视为重复通知，直接应答 success
 * 5. 通过条件更新 PENDING → PAID，并发投递只有一个请求能完成流转，其余同样应答 success
 */
@Slf4j
@Service
public class PayNotifyService {

    public static final String TRADE_SUCCESS = "TRADE_SUCCESS";

    private static final String OPERATION_PAY_NOTIFY = "PAY_NOTIFY";

    private final IOrderService orderService;
    private final IdempotentUtil idempotentUtil;
    private final PaymentProperties paymentProperties;

    public PayNotifyService(IOrderService orderService,
                            IdempotentUtil idempotentUtil,
                            PaymentProperties paymentProperties) {
        this.orderService = orderService;
        this.idempotentUtil = idempotentUtil;
        this.paymentProperties = paymentProperties;
    }

    /**
     * 处理平台异步通知（notify_url）
     *
     * @param params 平台回传的全部参数
     * @return 处理结果，其 token 原样返回给平台
     */
    public NotifyOutcome handleNotify(Map<String, String> params) {
        return process(params, "notify");
    }

    /**
     * 处理前端转发的同步回跳参数（return_url 上携带的签名参数）
     * 平台对回跳参数的签名方式与异步通知一致，验证通过后同样推进订单状态
     *
     * @param params 回跳地址上的全部参数
     * @return 处理结果
     */
    public NotifyOutcome confirmReturn(Map<String, String> params) {
        return process(params, "return");
    }

    private NotifyOutcome process(Map<String, String> params, String source) {
        String orderNo = params.get("out_trade_no");
        String tradeNo = params.get("trade_no");
        String tradeStatus = params.get("trade_status");
        String money = params.get("money");
        String traceId = TraceIdUtil.getTraceId();

        String key = paymentProperties.getKey();
        if (key == null || key.isBlank()) {
            log.error("[支付通知] 商户密钥未配置, source={}, orderNo={}", source, orderNo);
            return NotifyOutcome.ERROR;
        }

        // ==================== 1. 验证签名，防止伪造通知 ====================
        if (!SignUtil.verify(params, key)) {
            log.warn("[支付通知][安全] 签名验证失败, source={}, orderNo={}, traceId={}", source, orderNo, traceId);
            return NotifyOutcome.SIGN_ERROR;
        }

        // ==================== 2. 只处理支付成功状态 ====================
        if (!TRADE_SUCCESS.equals(tradeStatus)) {
            log.info("[支付通知] 非成功状态，跳过, source={}, orderNo={}, tradeStatus={}", source, orderNo, tradeStatus);
            return NotifyOutcome.SUCCESS;
        }

        // 快速判断：已确认过的订单直接应答
        if (orderNo != null && idempotentUtil.isOperated(orderNo, OPERATION_PAY_NOTIFY)) {
            log.info("[支付通知] 幂等凭证命中，跳过重复通知, source={}, orderNo={}", source, orderNo);
            return NotifyOutcome.SUCCESS;
        }

        try {
            // ==================== 3. 查询订单 ====================
            Optional<Order> found = orderNo == null ? Optional.empty() : orderService.getByOrderNo(orderNo);
            if (found.isEmpty()) {
                log.warn("[支付通知] 订单不存在, source={}, orderNo={}, traceId={}", source, orderNo, traceId);
                return NotifyOutcome.ORDER_NOT_FOUND;
            }
            Order order = found.get();

            // ==================== 4. 已处理的订单直接应答 ====================
            if (order.getStatus() != OrderStatus.PENDING) {
                log.info("[支付通知] 订单已处理，跳过重复通知, source={}, orderNo={}, status={}",
                        source, orderNo, order.getStatus());
                return NotifyOutcome.SUCCESS;
            }

            // ==================== 5. 金额一致性校验 ====================
            if (!amountMatches(order.getAmount(), money)) {
                log.error("[支付通知][安全] 金额不匹配，疑似伪造通知, source={}, orderNo={}, received={}, expected={}, traceId={}",
                        source, orderNo, money, order.getAmount(), traceId);
                return NotifyOutcome.AMOUNT_MISMATCH;
            }

            // ==================== 6. 条件更新 PENDING → PAID ====================
            TransitionFields fields = TransitionFields.builder()
                    .providerTradeNo(tradeNo)
                    .providerStatusText(tradeStatus)
                    .payMethod(PayMethod.fromCode(params.get("type")))
                    .build();
            boolean applied = orderService.compareAndTransition(orderNo, OrderStatus.PENDING, OrderStatus.PAID, fields);

            if (applied) {
                idempotentUtil.markAsOperated(orderNo, OPERATION_PAY_NOTIFY);
                log.info("[支付成功] source={}, orderNo={}, tradeNo={}, clientId={}, traceId={}",
                        source, orderNo, tradeNo, order.getClientId(), traceId);
            } else {
                log.info("[支付通知] 并发通知已完成状态流转, source={}, orderNo={}", source, orderNo);
            }
            return NotifyOutcome.SUCCESS;

        } catch (DataAccessException e) {
            log.error("[支付通知] 存储异常, source={}, orderNo={}, error={}, traceId={}",
                    source, orderNo, e.getMessage(), traceId, e);
            return NotifyOutcome.ERROR;
        }
    }

    /**
     * 金额按十进制数值精确比较（0.5 与 0.50 相等），无法解析视为不一致
     */
    private static boolean amountMatches(BigDecimal expected, String reported) {
        if (reported == null || reported.isBlank()) {
            return false;
        }
        try {
            return expected.compareTo(new BigDecimal(reported)) == 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
