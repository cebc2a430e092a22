package com.yanjiu.checkout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 图片分析服务配置（checkout.analysis.*），兼容 OpenAI chat completions 协议
 */
@Data
@ConfigurationProperties(prefix = "checkout.analysis")
public class AnalysisProperties {

    private String apiKey;

    private String baseUrl = "https://dashscope.aliyuncs.com/compatible-mode/v1";

    private String model = "qwen-vl-max";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(60);

    /**
     * 系统提示词，要求模型只输出JSON
     */
    private String systemPrompt = """
            你是一位专业的颜值分析与历史名人匹配 AI。
            请分析用户上传的人脸照片，根据五官特征、面部比例、气质风格，给出颜值评分，并匹配最相似的中国历史名人。
            你必须严格按照以下 JSON 格式返回，不得包含任何其他文字或 markdown 代码块：
            {
              "score": <颜值评分，整数，范围 1-100>,
              "celebrity": "<最相似的中国历史名人姓名>",
              "similarity": <面部相似度百分比，整数，范围 1-100>,
              "description": "<该历史名人的简短介绍，20-50 字>",
              "dynasty": "<该名人所在的朝代或时代，如：唐代、西汉、三国等>"
            }""";

    /**
     * 用户提示词，随图片一起发送
     */
    private String userPrompt = "请分析这张照片，返回颜值评分和最相似的中国历史名人。只输出纯 JSON，不要包含任何 markdown 代码块或额外文字。";
}
