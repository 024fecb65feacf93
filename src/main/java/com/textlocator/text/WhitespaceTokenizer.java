package com.textlocator.text;

import java.util.ArrayList;
import java.util.List;

public class WhitespaceTokenizer implements Tokenizer {

    /**
     * 按 Unicode 空白切分，词项为大小写折叠并去掉首尾标点后的比较键，偏移覆盖完整的原文单词。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int nextPosition = 0;
        int cursor = 0;

        while (cursor < text.length()) {
            int codePoint = text.codePointAt(cursor);
            if (NormalizedText.isWhitespace(codePoint)) {
                cursor += Character.charCount(codePoint);
                continue;
            }

            int wordStart = cursor;
            int wordEnd = cursor;
            while (wordEnd < text.length()) {
                int current = text.codePointAt(wordEnd);
                if (NormalizedText.isWhitespace(current)) {
                    break;
                }
                wordEnd += Character.charCount(current);
            }

            String word = text.substring(wordStart, wordEnd);
            tokens.add(new Token(comparisonKey(word), nextPosition, wordStart, wordEnd));
            nextPosition++;
            cursor = wordEnd;
        }

        return List.copyOf(tokens);
    }

    /**
     * 生成单词的比较键，纯标点单词保留原样（折叠后）。
     */
    static String comparisonKey(String word) {
        String folded = NormalizedText.foldCase(word);
        int start = 0;
        int end = folded.length();
        while (start < end && !Character.isLetterOrDigit(folded.codePointAt(start))) {
            start += Character.charCount(folded.codePointAt(start));
        }
        while (end > start && !Character.isLetterOrDigit(folded.codePointBefore(end))) {
            end -= Character.charCount(folded.codePointBefore(end));
        }
        return start < end ? folded.substring(start, end) : folded;
    }
}
