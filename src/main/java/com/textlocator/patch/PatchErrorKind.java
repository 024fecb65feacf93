package com.textlocator.patch;

public enum PatchErrorKind {
    /** 任何策略都没有找到原文 */
    NOT_FOUND,
    /** 严格校验：置信度低于阈值 */
    LOW_CONFIDENCE,
    /** 严格校验：命中区间明显短于原文 */
    INCOMPLETE_SPAN,
    /** 严格校验：命中区间不包含原文首尾关键短语 */
    KEY_PHRASE_MISMATCH
}
