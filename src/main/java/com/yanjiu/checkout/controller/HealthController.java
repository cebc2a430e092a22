package com.yanjiu.checkout.controller;

import com.yanjiu.checkout.business.AnalysisService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final AnalysisService analysisService;
    private final Clock clock;

    public HealthController(AnalysisService analysisService, Clock clock) {
        this.analysisService = analysisService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("time", Instant.now(clock).toString());
        response.put("payment_required", analysisService.isPaymentRequired());
        return response;
    }
}
