package com.yanjiu.checkout.controller;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yanjiu.checkout.analysis.AnalysisResult;
import com.yanjiu.checkout.business.AnalysisService;
import lombok.Data;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 分析控制器
 *
 * 未支付返回402，订单已使用返回409，订单不存在返回404
 */
@RestController
@RequestMapping("/api")
public class AnalyzeController {

    private final AnalysisService analysisService;

    public AnalyzeController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<Map<String, Object>> analyze(@RequestBody AnalyzeRequest request) {
        AnalysisResult result = analysisService.analyze(request.getImage(), request.getOrderNo());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("data", result);
        return ResponseEntity.ok(response);
    }

    @Data
    public static class AnalyzeRequest {

        /**
         * data URL 或纯 base64 图片
         */
        private String image;

        @JsonProperty("order_no")
        @JsonAlias("out_trade_no")
        private String orderNo;
    }
}
