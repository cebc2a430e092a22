package com.yanjiu.checkout.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 颜值分析结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisResult {

    /**
     * 颜值评分（1-100）
     */
    private int score;

    /**
     * 最相似的历史名人
     */
    private String celebrity;

    /**
     * 面部相似度百分比（1-100）
     */
    private int similarity;

    /**
     * 名人简介
     */
    private String description;

    /**
     * 名人所在朝代
     */
    private String dynasty;
}
