package com.textlocator.patch;

import com.textlocator.config.Constants;
import com.textlocator.config.LocatorConfig;
import com.textlocator.match.MatchResult;
import com.textlocator.text.NormalizedText;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 严格模式下对命中区间的额外校验，防止低质量匹配被直接替换。
 */
public class PatchValidator {
    private static final int KEY_PHRASE_WORDS = 2;
    private static final int KEY_PHRASE_MIN_WORDS = 3;

    private final double minConfidence;
    private final double minLengthRatio;

    public PatchValidator(LocatorConfig config) {
        this.minConfidence = config.getMinPatchConfidence();
        this.minLengthRatio = config.getMinPatchLengthRatio();
    }

    public Optional<PatchError> validate(MatchResult match, String originalText) {
        if (match.confidence() < minConfidence) {
            return Optional.of(new PatchError(PatchErrorKind.LOW_CONFIDENCE, originalText,
                String.format(Locale.ROOT, "Match confidence too low (%.2f). Manual verification recommended.", match.confidence())));
        }
        int originalLength = NormalizedText.collapsedLength(originalText);
        if (match.length() < originalLength * minLengthRatio) {
            return Optional.of(new PatchError(PatchErrorKind.INCOMPLETE_SPAN, originalText,
                "Matched text length (" + match.length() + ") is significantly shorter than original text ("
                    + originalLength + "). This could result in incomplete replacement."));
        }
        if (!containsKeyPhrases(match.matchedText(), originalText)) {
            return Optional.of(new PatchError(PatchErrorKind.KEY_PHRASE_MISMATCH, originalText,
                "Matched text doesn't contain key phrases from original text. Match may be incomplete or incorrect."));
        }
        return Optional.empty();
    }

    /**
     * 较长原文的前两个词与后两个词都必须出现在命中文本中，比较前先折叠大小写与空白。
     */
    boolean containsKeyPhrases(String matchedText, String originalText) {
        if (originalText.length() <= Constants.KEY_PHRASE_MIN_LENGTH) {
            return true;
        }
        String normalizedOriginal = NormalizedText.collapseWhitespace(originalText);
        String[] words = normalizedOriginal.split(" ");
        if (words.length < KEY_PHRASE_MIN_WORDS) {
            return true;
        }
        String firstPhrase = String.join(" ", Arrays.copyOfRange(words, 0, KEY_PHRASE_WORDS));
        String lastPhrase = String.join(" ", Arrays.copyOfRange(words, words.length - KEY_PHRASE_WORDS, words.length));
        String normalizedMatch = NormalizedText.collapseWhitespace(matchedText);
        return normalizedMatch.contains(firstPhrase) && normalizedMatch.contains(lastPhrase);
    }
}
