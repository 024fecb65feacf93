package com.textlocator.patch;

import com.textlocator.match.MatchResult;

/**
 * 补丁结果：applied 为 true 时 error 为 null，content 始终是调用结束后的完整文本。
 */
public record PatchResult(
    boolean applied,
    String content,
    MatchResult match,
    PatchError error
) {

    public static PatchResult success(String content, MatchResult match) {
        return new PatchResult(true, content, match, null);
    }

    public static PatchResult failure(String content, MatchResult match, PatchError error) {
        return new PatchResult(false, content, match, error);
    }
}
