package com.textlocator.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 定位器运行时配置
 * 
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class LocatorConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private int maxFuzzyContentLength = Constants.MAX_FUZZY_CONTENT_LENGTH;
    private int maxFuzzyQueryLength = Constants.MAX_FUZZY_QUERY_LENGTH;
    private long maxStrategyCost = Constants.MAX_STRATEGY_COST;
    private double fuzzyMinConfidence = Constants.FUZZY_MIN_CONFIDENCE;
    private int sentenceMinQueryLength = Constants.SENTENCE_MIN_QUERY_LENGTH;
    private double partialSentenceMinFraction = Constants.PARTIAL_SENTENCE_MIN_FRACTION;
    private int contextRadius = Constants.DEFAULT_CONTEXT_RADIUS;
    private boolean strictPatchValidation = false;
    private double minPatchConfidence = Constants.MIN_PATCH_CONFIDENCE;
    private double minPatchLengthRatio = Constants.MIN_PATCH_LENGTH_RATIO;
    
    public int getMaxFuzzyContentLength() {
        return maxFuzzyContentLength;
    }
    
    public void setMaxFuzzyContentLength(int maxFuzzyContentLength) {
        this.maxFuzzyContentLength = maxFuzzyContentLength;
    }
    
    public int getMaxFuzzyQueryLength() {
        return maxFuzzyQueryLength;
    }
    
    public void setMaxFuzzyQueryLength(int maxFuzzyQueryLength) {
        this.maxFuzzyQueryLength = maxFuzzyQueryLength;
    }
    
    public long getMaxStrategyCost() {
        return maxStrategyCost;
    }
    
    public void setMaxStrategyCost(long maxStrategyCost) {
        this.maxStrategyCost = maxStrategyCost;
    }
    
    public double getFuzzyMinConfidence() {
        return fuzzyMinConfidence;
    }
    
    public void setFuzzyMinConfidence(double fuzzyMinConfidence) {
        this.fuzzyMinConfidence = fuzzyMinConfidence;
    }
    
    public int getSentenceMinQueryLength() {
        return sentenceMinQueryLength;
    }
    
    public void setSentenceMinQueryLength(int sentenceMinQueryLength) {
        this.sentenceMinQueryLength = sentenceMinQueryLength;
    }
    
    public double getPartialSentenceMinFraction() {
        return partialSentenceMinFraction;
    }
    
    public void setPartialSentenceMinFraction(double partialSentenceMinFraction) {
        this.partialSentenceMinFraction = partialSentenceMinFraction;
    }
    
    public int getContextRadius() {
        return contextRadius;
    }
    
    public void setContextRadius(int contextRadius) {
        this.contextRadius = contextRadius;
    }
    
    public boolean isStrictPatchValidation() {
        return strictPatchValidation;
    }
    
    public void setStrictPatchValidation(boolean strictPatchValidation) {
        this.strictPatchValidation = strictPatchValidation;
    }
    
    public double getMinPatchConfidence() {
        return minPatchConfidence;
    }
    
    public void setMinPatchConfidence(double minPatchConfidence) {
        this.minPatchConfidence = minPatchConfidence;
    }
    
    public double getMinPatchLengthRatio() {
        return minPatchLengthRatio;
    }
    
    public void setMinPatchLengthRatio(double minPatchLengthRatio) {
        this.minPatchLengthRatio = minPatchLengthRatio;
    }

    /**
     * 校验配置取值范围，非法时抛出 IllegalArgumentException。
     */
    public LocatorConfig validate() {
        requirePositive("maxFuzzyContentLength", maxFuzzyContentLength);
        requirePositive("maxFuzzyQueryLength", maxFuzzyQueryLength);
        requirePositive("maxStrategyCost", maxStrategyCost);
        requirePositive("sentenceMinQueryLength", sentenceMinQueryLength);
        requireRatio("fuzzyMinConfidence", fuzzyMinConfidence);
        requireRatio("partialSentenceMinFraction", partialSentenceMinFraction);
        requireRatio("minPatchConfidence", minPatchConfidence);
        requireRatio("minPatchLengthRatio", minPatchLengthRatio);
        if (contextRadius < 0) {
            throw new IllegalArgumentException("contextRadius 不能为负数: " + contextRadius);
        }
        return this;
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " 必须为正数: " + value);
        }
    }

    private static void requireRatio(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " 必须位于 [0, 1] 区间: " + value);
        }
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static LocatorConfig defaults() {
        return new LocatorConfig();
    }

    /**
     * 从JSON配置文件加载，未出现的键保留默认值，未知键直接报错。
     */
    public static LocatorConfig load(Path configFile) throws IOException {
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile);
        }
        LocatorConfig config = MAPPER.readValue(configFile.toFile(), LocatorConfig.class);
        return config.validate();
    }
}
