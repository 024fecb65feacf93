package com.textlocator.patch;

/**
 * 补丁未应用的原因，携带失败的查询文本以便调用方提示用户。
 */
public record PatchError(
    PatchErrorKind kind,
    String query,
    String message
) {

    public static PatchError notFound(String query) {
        return new PatchError(PatchErrorKind.NOT_FOUND, query,
            "Original text not found in document. Search attempted with multiple strategies but no suitable match was found.");
    }
}
