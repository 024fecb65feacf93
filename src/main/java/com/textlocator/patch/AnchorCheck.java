package com.textlocator.patch;

/**
 * 锚点校验结果。insertionPoint 为 -1 表示锚点未找到；suggestedAnchor 可能为 null。
 */
public record AnchorCheck(
    boolean valid,
    int insertionPoint,
    String message,
    String suggestedAnchor
) {

    static AnchorCheck ok(int insertionPoint) {
        return new AnchorCheck(true, insertionPoint, null, null);
    }

    static AnchorCheck rejected(int insertionPoint, String message, String suggestedAnchor) {
        return new AnchorCheck(false, insertionPoint, message, suggestedAnchor);
    }
}
