package com.yanjiu.checkout.business;

import com.yanjiu.checkout.analysis.AnalysisResult;
import com.yanjiu.checkout.analysis.ImageAnalyzer;
import com.yanjiu.checkout.config.PaymentProperties;
import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.exception.BusinessException;
import com.yanjiu.checkout.exception.ErrorCode;
import com.yanjiu.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 付费分析服务
 * <p>
 * 业务流程：
 * 1. 校验图片
 * 2. 已配置支付时，先通过分析闸门消费订单（PAID → ANALYZED）
 * 3. 调用外部分析服务
 * <p>
 * 订单在调用分析服务之前消费，分析失败不退回额度
 */
@Slf4j
@Service
public class AnalysisService {

    private static final String DATA_URL_PREFIX = "data:";

    private final AnalysisGate analysisGate;
    private final ImageAnalyzer imageAnalyzer;
    private final PaymentProperties paymentProperties;

    public AnalysisService(AnalysisGate analysisGate,
                           ImageAnalyzer imageAnalyzer,
                           PaymentProperties paymentProperties) {
        this.analysisGate = analysisGate;
        this.imageAnalyzer = imageAnalyzer;
        this.paymentProperties = paymentProperties;
    }

    /**
     * 分析图片
     *
     * @param image data URL 或纯 base64 图片
     * @param orderNo 已支付的商户订单号，未配置支付时可为空
     * @return 分析结果
     */
    public AnalysisResult analyze(String image, String orderNo) {
        if (image == null || image.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "缺少 image 字段");
        }

        if (paymentProperties.isConfigured()) {
            if (orderNo == null || orderNo.isBlank()) {
                throw new BusinessException(ErrorCode.ORDER_NOT_PAID, "请先完成支付后再进行分析");
            }
            Order order = analysisGate.consumeForAnalysis(orderNo);
            log.info("[开始分析] orderNo={}, clientId={}, traceId={}",
                    orderNo, order.getClientId(), TraceIdUtil.getTraceId());
        } else {
            log.info("[开始分析] 未配置支付，跳过订单校验, traceId={}", TraceIdUtil.getTraceId());
        }

        String imageUrl = image.startsWith(DATA_URL_PREFIX) ? image : "data:image/jpeg;base64," + image;
        return imageAnalyzer.analyze(imageUrl);
    }

    public boolean isPaymentRequired() {
        return paymentProperties.isConfigured();
    }
}
