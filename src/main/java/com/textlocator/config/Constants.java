package com.textlocator.config;

/**
 * 全局常量定义
 * 
 * 包含各匹配层级的置信度、长度充分性比例、模糊匹配参数、句子匹配参数和补丁校验参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 置信度 ====================
    /** 精确匹配置信度 */
    public static final double EXACT_CONFIDENCE = 1.0;
    /** 忽略大小写匹配置信度 */
    public static final double CASE_INSENSITIVE_CONFIDENCE = 0.95;
    /** 空白归一化匹配置信度 */
    public static final double NORMALIZED_WHITESPACE_CONFIDENCE = 0.85;
    /** 模糊匹配置信度下限，同时是模糊匹配的接受阈值 */
    public static final double FUZZY_MIN_CONFIDENCE = 0.6;
    
    // ==================== 长度充分性 ====================
    /** 前三个层级匹配长度相对查询长度的最小比例 */
    public static final double STRICT_MIN_LENGTH_RATIO = 0.8;
    /** 模糊匹配长度相对查询长度的最小比例 */
    public static final double FUZZY_MIN_LENGTH_RATIO = 0.7;
    /** 模糊匹配必须覆盖的查询词比例 */
    public static final double FUZZY_MIN_TOKEN_COVERAGE = 0.8;
    
    // ==================== 模糊匹配参数 ====================
    /** 单词允许的最小编辑距离上限 */
    public static final int FUZZY_MIN_EDIT_DISTANCE = 2;
    /** 单词允许的编辑距离占较长单词长度的比例 */
    public static final double FUZZY_EDIT_DISTANCE_RATIO = 0.2;
    /** 窗口得分中"命中比例"的权重，其余权重给"顺序一致性" */
    public static final double FUZZY_FOUND_WEIGHT = 0.7;
    /** 超过该长度的文档跳过模糊匹配 */
    public static final int MAX_FUZZY_CONTENT_LENGTH = 50_000;
    /** 超过该长度的查询跳过模糊匹配 */
    public static final int MAX_FUZZY_QUERY_LENGTH = 1_000;
    
    // ==================== 句子匹配参数 ====================
    /** 超过该字符数的查询视为句子 */
    public static final int SENTENCE_MIN_QUERY_LENGTH = 40;
    /** 句子匹配要求的最少查询词数 */
    public static final int SENTENCE_MIN_TOKENS = 3;
    /** 句子匹配的对齐词比例下限 */
    public static final double PARTIAL_SENTENCE_MIN_FRACTION = 0.4;
    
    // ==================== 成本预算 ====================
    /** 单个分词策略允许的词项比较次数上限 */
    public static final long MAX_STRATEGY_COST = 20_000_000L;
    
    // ==================== 补丁校验参数 ====================
    /** 严格校验时补丁要求的最低置信度 */
    public static final double MIN_PATCH_CONFIDENCE = 0.6;
    /** 严格校验时匹配长度相对原文长度的最小比例 */
    public static final double MIN_PATCH_LENGTH_RATIO = 0.5;
    /** 严格校验时触发关键短语检查的原文长度 */
    public static final int KEY_PHRASE_MIN_LENGTH = 20;
    
    // ==================== 上下文参数 ====================
    /** 上下文单侧字符数 */
    public static final int DEFAULT_CONTEXT_RADIUS = 100;
    
    // ==================== 锚点参数 ====================
    /** 向后寻找更佳锚点的最大距离 */
    public static final int ANCHOR_MAX_SEARCH_DISTANCE = 500;
    /** 更佳锚点向前包含的上下文字符数 */
    public static final int ANCHOR_LEADING_CONTEXT = 50;
    /** 更佳锚点的最小长度 */
    public static final int ANCHOR_MIN_LENGTH = 10;
    /** 短于该长度的锚点视为有意的最小锚点 */
    public static final int ANCHOR_SHORT_LENGTH = 15;
}
