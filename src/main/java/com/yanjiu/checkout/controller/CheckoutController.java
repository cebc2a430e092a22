package com.yanjiu.checkout.controller;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yanjiu.checkout.business.CheckoutService;
import com.yanjiu.checkout.business.NotifyOutcome;
import com.yanjiu.checkout.business.PayNotifyService;
import com.yanjiu.checkout.domain.Order;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 支付控制器
 *
 * API规范：
 * - POST /api/checkout/providers/zpay/url - 创建订单并获取支付跳转链接
 * - GET|POST /api/checkout/providers/zpay/webhook - 平台异步通知，应答纯文本
 * - POST /api/checkout/providers/zpay/confirm-return - 前端转发回跳参数确认支付
 * - GET /api/checkout/providers/zpay/status - 前端轮询订单状态
 */
@Slf4j
@RestController
@RequestMapping("/api/checkout/providers/zpay")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final PayNotifyService payNotifyService;

    public CheckoutController(CheckoutService checkoutService, PayNotifyService payNotifyService) {
        this.checkoutService = checkoutService;
        this.payNotifyService = payNotifyService;
    }

    /**
     * 创建订单
     *
     * 请求体：
     * {
     *     "client_id": "9b1d...",
     *     "pay_method": "alipay"
     * }
     *
     * 响应：
     * {
     *     "success": true,
     *     "url": "https://zpayz.cn/submit.php?pid=...&sign=...&sign_type=MD5",
     *     "order_no": "20260219231505342"
     * }
     */
    @PostMapping("/url")
    public ResponseEntity<Map<String, Object>> createCheckout(@RequestBody CreateCheckoutRequest request) {
        CheckoutService.CheckoutResult result =
                checkoutService.createCheckout(request.getClientId(), request.getPayMethod());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("url", result.redirectUrl());
        response.put("order_no", result.orderNo());
        return ResponseEntity.ok(response);
    }

    /**
     * 平台异步通知
     * 参数在查询串（GET）或表单（POST）中，必须返回纯文本 "success"，否则平台会重试
     */
    @RequestMapping(value = "/webhook", method = {RequestMethod.GET, RequestMethod.POST},
            produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> webhook(@RequestParam MultiValueMap<String, String> params) {
        NotifyOutcome outcome = payNotifyService.handleNotify(params.toSingleValueMap());
        return ResponseEntity.status(outcome.getStatus()).body(outcome.getToken());
    }

    /**
     * 同步回跳确认
     * 前端把 return_url 上的全部参数原样转发过来，验签通过后推进订单状态
     */
    @PostMapping("/confirm-return")
    public ResponseEntity<Map<String, Object>> confirmReturn(@RequestBody Map<String, String> params) {
        NotifyOutcome outcome = payNotifyService.confirmReturn(params);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", outcome.isAcknowledged());
        response.put("message", outcome.getMessage());
        return ResponseEntity.status(outcome.getStatus()).body(response);
    }

    /**
     * 查询订单支付状态
     *
     * 响应：
     * {
     *     "success": true,
     *     "status": "paid",
     *     "client_id": "9b1d..."
     * }
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(
            @RequestParam(value = "order_no", required = false) String orderNo,
            @RequestParam(value = "out_trade_no", required = false) String outTradeNo) {
        Order order = checkoutService.queryStatus(orderNo != null ? orderNo : outTradeNo);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("status", order.getStatus().getCode());
        response.put("client_id", order.getClientId());
        return ResponseEntity.ok(response);
    }

    /**
     * 创建订单请求，兼容旧字段名 uid / pay_type
     */
    @Data
    public static class CreateCheckoutRequest {

        @JsonProperty("client_id")
        @JsonAlias("uid")
        private String clientId;

        @JsonProperty("pay_method")
        @JsonAlias("pay_type")
        private String payMethod;
    }
}
