package com.yanjiu.checkout.business;

import com.yanjiu.checkout.config.PaymentProperties;
import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.OrderStatus;
import com.yanjiu.checkout.domain.PayMethod;
import com.yanjiu.checkout.domain.TransitionFields;
import com.yanjiu.checkout.service.IOrderService;
import com.yanjiu.checkout.util.IdempotentUtil;
import com.yanjiu.checkout.util.SignUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PayNotifyServiceTest {

    private static final String KEY = "test-merchant-key";
    private static final String ORDER_NO = "20260219231505342";

    @Mock
    private IOrderService orderService;

    @Mock
    private IdempotentUtil idempotentUtil;

    private PaymentProperties paymentProperties;

    private PayNotifyService payNotifyService;

    @BeforeEach
    void setUp() {
        paymentProperties = new PaymentProperties();
        paymentProperties.setPid("1001");
        paymentProperties.setKey(KEY);
        paymentProperties.setBaseUrl("https://shop.example.com");
        payNotifyService = new PayNotifyService(orderService, idempotentUtil, paymentProperties);
    }

    @Test
    @DisplayName("验签通过的成功通知将订单推进为已支付")
    void notifyMarksPendingOrderPaid() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(orderService.compareAndTransition(eq(ORDER_NO), eq(OrderStatus.PENDING), eq(OrderStatus.PAID), any()))
                .thenReturn(true);

        NotifyOutcome outcome = payNotifyService.handleNotify(signed(notifyParams("0.50")));

        assertThat(outcome).isEqualTo(NotifyOutcome.SUCCESS);
        assertThat(outcome.getToken()).isEqualTo("success");

        ArgumentCaptor<TransitionFields> captor = ArgumentCaptor.forClass(TransitionFields.class);
        verify(orderService).compareAndTransition(eq(ORDER_NO), eq(OrderStatus.PENDING), eq(OrderStatus.PAID),
                captor.capture());
        assertThat(captor.getValue().getProviderTradeNo()).isEqualTo("2026021922001");
        assertThat(captor.getValue().getProviderStatusText()).isEqualTo("TRADE_SUCCESS");
        assertThat(captor.getValue().getPayMethod()).isEqualTo(PayMethod.WXPAY);
        verify(idempotentUtil).markAsOperated(ORDER_NO, "PAY_NOTIFY");
    }

    @Test
    @DisplayName("金额写法不同但数值相等视为一致")
    void notifyComparesAmountNumerically() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(orderService.compareAndTransition(eq(ORDER_NO), eq(OrderStatus.PENDING), eq(OrderStatus.PAID), any()))
                .thenReturn(true);

        assertThat(payNotifyService.handleNotify(signed(notifyParams("0.5")))).isEqualTo(NotifyOutcome.SUCCESS);
    }

    @Test
    @DisplayName("签名错误时拒绝且不读写订单")
    void notifyRejectsForgedSign() {
        Map<String, String> params = signed(notifyParams("0.50"));
        params.put("sign", "0123456789abcdef0123456789abcdef");

        NotifyOutcome outcome = payNotifyService.handleNotify(params);

        assertThat(outcome).isEqualTo(NotifyOutcome.SIGN_ERROR);
        assertThat(outcome.getStatus().value()).isEqualTo(400);
        verifyNoInteractions(orderService, idempotentUtil);
    }

    @Test
    @DisplayName("签名后篡改金额同样验签失败")
    void notifyRejectsTamperedAmount() {
        Map<String, String> params = signed(notifyParams("0.50"));
        params.put("money", "0.01");

        assertThat(payNotifyService.handleNotify(params)).isEqualTo(NotifyOutcome.SIGN_ERROR);
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("缺少签名视为签名错误")
    void notifyRejectsMissingSign() {
        assertThat(payNotifyService.handleNotify(notifyParams("0.50"))).isEqualTo(NotifyOutcome.SIGN_ERROR);
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("非成功状态直接应答 success 且不修改订单")
    void notifyIgnoresNonSuccessStatus() {
        Map<String, String> params = notifyParams("0.50");
        params.put("trade_status", "WAIT_BUYER_PAY");

        assertThat(payNotifyService.handleNotify(signed(params))).isEqualTo(NotifyOutcome.SUCCESS);
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("订单不存在时返回 order not found")
    void notifyUnknownOrder() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.empty());

        NotifyOutcome outcome = payNotifyService.handleNotify(signed(notifyParams("0.50")));

        assertThat(outcome).isEqualTo(NotifyOutcome.ORDER_NOT_FOUND);
        assertThat(outcome.getToken()).isEqualTo("order not found");
        verify(orderService, never()).compareAndTransition(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("金额不一致时拒绝，订单保持待支付")
    void notifyRejectsAmountMismatch() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.of(order(OrderStatus.PENDING)));

        NotifyOutcome outcome = payNotifyService.handleNotify(signed(notifyParams("5.00")));

        assertThat(outcome).isEqualTo(NotifyOutcome.AMOUNT_MISMATCH);
        assertThat(outcome.getToken()).isEqualTo("amount mismatch");
        verify(orderService, never()).compareAndTransition(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("无法解析的金额视为不一致")
    void notifyRejectsUnparsableAmount() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.of(order(OrderStatus.PENDING)));

        assertThat(payNotifyService.handleNotify(signed(notifyParams("abc")))).isEqualTo(NotifyOutcome.AMOUNT_MISMATCH);
    }

    @Test
    @DisplayName("已支付或已分析的订单重复通知直接应答 success")
    void notifyIsIdempotentForProcessedOrders() {
        when(orderService.getByOrderNo(ORDER_NO))
                .thenReturn(Optional.of(order(OrderStatus.PAID)), Optional.of(order(OrderStatus.ANALYZED)));

        assertThat(payNotifyService.handleNotify(signed(notifyParams("0.50")))).isEqualTo(NotifyOutcome.SUCCESS);
        assertThat(payNotifyService.handleNotify(signed(notifyParams("0.50")))).isEqualTo(NotifyOutcome.SUCCESS);
        verify(orderService, never()).compareAndTransition(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("并发通知未抢到状态流转时同样应答 success")
    void notifyLosingRaceStillAcknowledges() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(orderService.compareAndTransition(eq(ORDER_NO), eq(OrderStatus.PENDING), eq(OrderStatus.PAID), any()))
                .thenReturn(false);

        assertThat(payNotifyService.handleNotify(signed(notifyParams("0.50")))).isEqualTo(NotifyOutcome.SUCCESS);
        verify(idempotentUtil, never()).markAsOperated(anyString(), anyString());
    }

    @Test
    @DisplayName("幂等凭证命中时跳过数据库")
    void notifySkipsWhenMarkerPresent() {
        when(idempotentUtil.isOperated(ORDER_NO, "PAY_NOTIFY")).thenReturn(true);

        assertThat(payNotifyService.handleNotify(signed(notifyParams("0.50")))).isEqualTo(NotifyOutcome.SUCCESS);
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("存储异常时返回 error，平台稍后重试")
    void notifyStorageFailure() {
        when(orderService.getByOrderNo(ORDER_NO)).thenThrow(new QueryTimeoutException("db timeout"));

        NotifyOutcome outcome = payNotifyService.handleNotify(signed(notifyParams("0.50")));

        assertThat(outcome).isEqualTo(NotifyOutcome.ERROR);
        assertThat(outcome.getStatus().value()).isEqualTo(500);
    }

    @Test
    @DisplayName("未配置商户密钥时返回 error")
    void notifyWithoutKey() {
        Map<String, String> params = signed(notifyParams("0.50"));
        paymentProperties.setKey("");

        assertThat(payNotifyService.handleNotify(params)).isEqualTo(NotifyOutcome.ERROR);
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("同步回跳参数验签通过后同样推进订单状态")
    void confirmReturnMarksPaid() {
        when(orderService.getByOrderNo(ORDER_NO)).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(orderService.compareAndTransition(eq(ORDER_NO), eq(OrderStatus.PENDING), eq(OrderStatus.PAID), any()))
                .thenReturn(true);

        NotifyOutcome outcome = payNotifyService.confirmReturn(signed(notifyParams("0.50")));

        assertThat(outcome.isAcknowledged()).isTrue();
    }

    private static Order order(OrderStatus status) {
        return Order.builder()
                .orderNo(ORDER_NO)
                .clientId("u1")
                .amount(new BigDecimal("0.50"))
                .payMethod(PayMethod.ALIPAY)
                .status(status)
                .build();
    }

    private static Map<String, String> notifyParams(String money) {
        Map<String, String> params = new HashMap<>();
        params.put("pid", "1001");
        params.put("trade_no", "2026021922001");
        params.put("out_trade_no", ORDER_NO);
        params.put("type", "wxpay");
        params.put("name", "颜究院颜值分析");
        params.put("money", money);
        params.put("trade_status", "TRADE_SUCCESS");
        return params;
    }

    private static Map<String, String> signed(Map<String, String> params) {
        params.put("sign", SignUtil.sign(params, KEY));
        params.put("sign_type", "MD5");
        return params;
    }
}
