package com.yanjiu.checkout.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yanjiu.checkout.config.AnalysisProperties;
import com.yanjiu.checkout.exception.BusinessException;
import com.yanjiu.checkout.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于通义千问 VL（OpenAI 兼容接口）的图片分析实现
 * 模型对 response_format 的支持不稳定，由提示词约束只输出JSON，解析失败时提取回复中的第一个JSON对象
 */
@Slf4j
@Component
public class QwenVlImageAnalyzer implements ImageAnalyzer {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private final AnalysisProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public QwenVlImageAnalyzer(AnalysisProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        this.restClient = RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public AnalysisResult analyze(String imageUrl) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new BusinessException(ErrorCode.ANALYSIS_NOT_CONFIGURED);
        }

        Map<String, Object> request = Map.of(
                "model", properties.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", properties.getSystemPrompt()),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", properties.getUserPrompt()),
                                Map.of("type", "image_url", "image_url", Map.of("url", imageUrl))
                        ))
                )
        );

        JsonNode response;
        long startTime = System.currentTimeMillis();
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.error("[图片分析超时] model={}, timeout={}", properties.getModel(), properties.getReadTimeout());
                throw new BusinessException(ErrorCode.ANALYSIS_TIMEOUT, ErrorCode.ANALYSIS_TIMEOUT.getMessage(), e);
            }
            throw new BusinessException(ErrorCode.ANALYSIS_FAILED, "分析服务不可用: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new BusinessException(ErrorCode.ANALYSIS_FAILED, "分析服务调用失败: " + e.getMessage(), e);
        }
        log.info("[图片分析完成] model={}, 耗时={}ms", properties.getModel(), System.currentTimeMillis() - startTime);

        String content = response == null ? "" : response.path("choices").path(0).path("message").path("content").asText("");
        return parseReply(content);
    }

    /**
     * 解析模型回复，缺失字段使用默认值
     */
    AnalysisResult parseReply(String raw) {
        JsonNode node = readJson(raw);
        int score = node.path("score").asInt(0);
        int similarity = node.path("similarity").asInt(0);
        String celebrity = node.path("celebrity").asText("");
        return AnalysisResult.builder()
                .score(score == 0 ? 80 : score)
                .celebrity(celebrity.isEmpty() ? "历史名人" : celebrity)
                .similarity(similarity == 0 ? 70 : similarity)
                .description(node.path("description").asText(""))
                .dynasty(node.path("dynasty").asText(""))
                .build();
    }

    private JsonNode readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BusinessException(ErrorCode.ANALYSIS_FAILED, "AI 返回内容为空");
        }
        JsonNode node = tryReadObject(raw);
        if (node == null) {
            // 回复中夹带说明文字或代码块时，取第一个 { 到最后一个 } 之间的内容
            Matcher matcher = JSON_OBJECT.matcher(raw);
            if (matcher.find()) {
                node = tryReadObject(matcher.group());
            }
        }
        if (node == null) {
            log.warn("[图片分析] 回复无法解析为JSON, raw={}", raw);
            throw new BusinessException(ErrorCode.ANALYSIS_FAILED, "AI 返回内容无法解析为 JSON");
        }
        return node;
    }

    private JsonNode tryReadObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("[图片分析] JSON解析失败, error={}", e.getOriginalMessage());
            return null;
        }
    }
}
