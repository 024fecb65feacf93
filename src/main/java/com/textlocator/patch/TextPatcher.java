package com.textlocator.patch;

import com.textlocator.config.LocatorConfig;
import com.textlocator.match.MatchResult;
import com.textlocator.match.TextLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 在定位到的区间上应用修改。
 *
 * <p>只替换定位器给出的 {@code [index, index + length)} 一处，不做全局查找替换；
 * 替换后校验区间外的文本与调用前逐字符一致。
 */
public class TextPatcher {
    private static final Logger logger = LoggerFactory.getLogger(TextPatcher.class);

    private final TextLocator locator;
    private final PatchValidator validator;
    private final boolean strictValidation;

    public TextPatcher() {
        this(LocatorConfig.defaults());
    }

    public TextPatcher(LocatorConfig config) {
        this(new TextLocator(config), config);
    }

    public TextPatcher(TextLocator locator, LocatorConfig config) {
        this.locator = locator;
        this.validator = new PatchValidator(config);
        this.strictValidation = config.isStrictPatchValidation();
    }

    /**
     * 就地修改调用方持有的缓冲区。未命中或校验失败时缓冲区保持不变。
     */
    public PatchResult apply(StringBuilder content, String originalText, String changedText) {
        String before = content.toString();
        MatchResult match = locator.locate(before, originalText);
        if (!match.found()) {
            logger.debug("原文未找到，放弃修改");
            return PatchResult.failure(before, match, PatchError.notFound(originalText));
        }

        if (strictValidation) {
            Optional<PatchError> rejection = validator.validate(match, originalText);
            if (rejection.isPresent()) {
                logger.debug("严格校验拒绝修改: {}", rejection.get().kind());
                return PatchResult.failure(before, match, rejection.get());
            }
        }

        String replacement = changedText == null ? "" : changedText;
        splice(content, before, match.index(), match.length(), replacement);
        logger.debug("使用 {} 匹配完成替换: index={}, length={}",
            match.matchType().label(), match.index(), match.length());
        return PatchResult.success(content.toString(), match);
    }

    /**
     * 对不可变文本应用修改，新文本通过 {@link PatchResult#content()} 返回。
     */
    public PatchResult apply(String content, String originalText, String changedText) {
        return apply(new StringBuilder(content == null ? "" : content), originalText, changedText);
    }

    /**
     * 在锚点文本所在区间的末尾插入内容。
     */
    public PatchResult insertAfter(StringBuilder content, String anchorText, String insertedText) {
        String before = content.toString();
        MatchResult match = locator.locate(before, anchorText);
        if (!match.found()) {
            return PatchResult.failure(before, match, PatchError.notFound(anchorText));
        }
        String insertion = insertedText == null ? "" : insertedText;
        splice(content, before, match.endIndex(), 0, insertion);
        return PatchResult.success(content.toString(), match);
    }

    private static void splice(StringBuilder content, String before, int index, int length, String replacement) {
        content.replace(index, index + length, replacement);
        verifyOutsideUntouched(before, content.toString(), index, length, replacement.length());
    }

    /**
     * 替换区间以外的前缀与后缀必须与修改前完全一致。
     */
    static void verifyOutsideUntouched(String before, String after, int index, int replacedLength, int insertedLength) {
        int suffixLength = before.length() - index - replacedLength;
        boolean intact = after.length() == index + insertedLength + suffixLength
            && after.regionMatches(0, before, 0, index)
            && after.regionMatches(index + insertedLength, before, index + replacedLength, suffixLength);
        if (!intact) {
            throw new IllegalStateException(
                "替换区间以外的文本被改动: index=" + index + ", length=" + replacedLength);
        }
    }
}
