package com.yanjiu.checkout.analysis;

/**
 * 外部图片分析服务
 */
public interface ImageAnalyzer {

    /**
     * 分析图片
     *
     * @param imageUrl data URL 形式的图片（data:image/...;base64,...）
     * @return 分析结果
     * @throws com.yanjiu.checkout.exception.BusinessException
     *         ANALYSIS_NOT_CONFIGURED / ANALYSIS_TIMEOUT / ANALYSIS_FAILED
     */
    AnalysisResult analyze(String imageUrl);
}
