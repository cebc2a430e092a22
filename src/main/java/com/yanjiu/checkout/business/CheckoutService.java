package com.yanjiu.checkout.business;

import com.yanjiu.checkout.config.PaymentProperties;
import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.OrderStatus;
import com.yanjiu.checkout.domain.PayMethod;
import com.yanjiu.checkout.exception.BusinessException;
import com.yanjiu.checkout.exception.DuplicateOrderNoException;
import com.yanjiu.checkout.exception.ErrorCode;
import com.yanjiu.checkout.service.IOrderService;
import com.yanjiu.checkout.util.OrderNoGenerator;
import com.yanjiu.checkout.util.SignUtil;
import com.yanjiu.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 下单服务
 * <p>
 * 完整流程：
 * 1. 校验支付方式
 * 2. 生成商户订单号并写入订单（状态：PENDING），订单号冲突时有限次重试
 * 3. 构建平台参数并签名，拼接支付跳转链接
 * <p>
 * 除一次订单插入外没有其他副作用
 */
@Slf4j
@Service
public class CheckoutService {

    private final IOrderService orderService;
    private final OrderNoGenerator orderNoGenerator;
    private final PaymentProperties paymentProperties;

    public CheckoutService(IOrderService orderService,
                           OrderNoGenerator orderNoGenerator,
                           PaymentProperties paymentProperties) {
        this.orderService = orderService;
        this.orderNoGenerator = orderNoGenerator;
        this.paymentProperties = paymentProperties;
    }

    /**
     * 创建支付订单并生成跳转链接
     *
     * @param clientId 客户端标识
     * @param payMethodCode 支付方式（alipay / wxpay），为空时默认 alipay
     * @return 商户订单号与支付跳转链接
     * @throws BusinessException INVALID_INPUT / PAYMENT_NOT_CONFIGURED / ORDER_NO_EXHAUSTED
     */
    public CheckoutResult createCheckout(String clientId, String payMethodCode) {
        // ==================== 1. 参数校验 ====================
        if (clientId == null || clientId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "缺少用户标识 client_id");
        }
        PayMethod payMethod = payMethodCode == null || payMethodCode.isEmpty()
                ? PayMethod.ALIPAY
                : PayMethod.fromCode(payMethodCode);
        if (payMethod == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "pay_method 仅支持 alipay 或 wxpay");
        }
        if (!paymentProperties.isConfigured()) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_CONFIGURED,
                    "支付配置缺失：请检查 ZPAY_PID、ZPAY_KEY、APP_BASE_URL 环境变量");
        }

        // ==================== 2. 生成订单号并写入订单 ====================
        Order order = insertPendingOrder(clientId, payMethod);

        // ==================== 3. 构建签名参数并拼接支付链接 ====================
        String redirectUrl = buildRedirectUrl(order);

        log.info("[创建订单] orderNo={}, clientId={}, amount={}, payMethod={}, traceId={}",
                order.getOrderNo(), clientId, order.getAmount(), payMethod.getCode(), TraceIdUtil.getTraceId());
        return new CheckoutResult(order.getOrderNo(), redirectUrl);
    }

    /**
     * 查询订单，供前端轮询支付状态
     *
     * @param orderNo 商户订单号
     * @return 订单
     * @throws BusinessException INVALID_INPUT / ORDER_NOT_FOUND
     */
    public Order queryStatus(String orderNo) {
        if (orderNo == null || orderNo.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "缺少 order_no 参数");
        }
        return orderService.getByOrderNo(orderNo)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    private Order insertPendingOrder(String clientId, PayMethod payMethod) {
        int maxAttempts = Math.max(1, paymentProperties.getMaxCreateAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Order order = Order.builder()
                    .orderNo(orderNoGenerator.next())
                    .clientId(clientId)
                    .amount(paymentProperties.getAmount())
                    .payMethod(payMethod)
                    .status(OrderStatus.PENDING)
                    .build();
            try {
                orderService.insertOrder(order);
                return order;
            } catch (DuplicateOrderNoException e) {
                log.warn("[订单号冲突] orderNo={}, attempt={}/{}", e.getOrderNo(), attempt, maxAttempts);
            }
        }
        log.error("[创建订单失败] 订单号连续冲突 {} 次, clientId={}", maxAttempts, clientId);
        throw new BusinessException(ErrorCode.ORDER_NO_EXHAUSTED);
    }

    private String buildRedirectUrl(Order order) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("pid", paymentProperties.getPid());
        params.put("name", paymentProperties.getProductName());
        params.put("money", order.getAmount().toPlainString());
        params.put("out_trade_no", order.getOrderNo());
        params.put("notify_url", paymentProperties.notifyUrl());
        // 平台的回跳地址不支持携带参数，支付完成后跳回首页
        params.put("return_url", paymentProperties.returnUrl());
        params.put("type", order.getPayMethod().getCode());

        params.put(SignUtil.SIGN, SignUtil.sign(params, paymentProperties.getKey()));
        params.put(SignUtil.SIGN_TYPE, SignUtil.SIGN_TYPE_MD5);

        String query = params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return paymentProperties.getSubmitUrl() + "?" + query;
    }

    /**
     * 下单结果
     */
    public record CheckoutResult(String orderNo, String redirectUrl) {
    }
}
