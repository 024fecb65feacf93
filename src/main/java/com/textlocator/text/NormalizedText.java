package com.textlocator.text;

import java.util.Arrays;
import java.util.Locale;

/**
 * 归一化文本及其到原文的位置映射。
 *
 * <p>归一化串中的每个字符都记录了产生它的原文片段 {@code [sourceStart, sourceEnd)}，
 * 因此归一化空间中的任意区间都可以精确地换算回原文区间。
 */
public final class NormalizedText {

    private final String source;
    private final String text;
    private final int[] sourceStarts;
    private final int[] sourceEnds;

    private NormalizedText(String source, String text, int[] sourceStarts, int[] sourceEnds) {
        this.source = source;
        this.text = text;
        this.sourceStarts = sourceStarts;
        this.sourceEnds = sourceEnds;
    }

    /**
     * 仅做大小写折叠，保留全部空白。
     */
    public static NormalizedText caseFolded(String source) {
        return build(source, false);
    }

    /**
     * 大小写折叠，并把连续空白折叠为单个空格，去掉首尾空白。
     */
    public static NormalizedText whitespaceCollapsed(String source) {
        return build(source, true);
    }

    /**
     * 返回大小写折叠后的文本，不保留映射。
     */
    public static String foldCase(String value) {
        return build(value, false).text();
    }

    /**
     * 返回大小写折叠并折叠空白后的文本，不保留映射。
     */
    public static String collapseWhitespace(String value) {
        return build(value, true).text();
    }

    /**
     * 把空白折叠为单个空格并去掉首尾空白后的长度，不做大小写折叠。命中长度以此为基准衡量。
     */
    public static int collapsedLength(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        int length = 0;
        boolean pendingSpace = false;
        int cursor = 0;
        while (cursor < value.length()) {
            int codePoint = value.codePointAt(cursor);
            int width = Character.charCount(codePoint);
            if (isWhitespace(codePoint)) {
                pendingSpace = length > 0;
            } else {
                if (pendingSpace) {
                    length++;
                    pendingSpace = false;
                }
                length += width;
            }
            cursor += width;
        }
        return length;
    }

    /**
     * Unicode 空白判定，包含不换行空格等 isWhitespace 不认的空格字符。
     */
    public static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    public String source() {
        return source;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /**
     * 归一化下标对应的原文起点。
     */
    public int sourceStart(int normalizedIndex) {
        if (normalizedIndex >= sourceStarts.length) {
            return source.length();
        }
        return sourceStarts[normalizedIndex];
    }

    /**
     * 归一化区间终点（不含）对应的原文终点，即区间最后一个字符所覆盖原文片段的终点。
     */
    public int sourceEnd(int normalizedEndExclusive) {
        if (normalizedEndExclusive <= 0) {
            return sourceStart(0);
        }
        int lastIndex = Math.min(normalizedEndExclusive, sourceEnds.length) - 1;
        return sourceEnds[lastIndex];
    }

    private static NormalizedText build(String source, boolean collapseWhitespace) {
        String safeSource = source == null ? "" : source;
        StringBuilder builder = new StringBuilder(safeSource.length());
        int[] starts = new int[safeSource.length() + 8];
        int[] ends = new int[safeSource.length() + 8];
        int size = 0;
        int pendingSpaceStart = -1;
        int cursor = 0;

        while (cursor < safeSource.length()) {
            int codePoint = safeSource.codePointAt(cursor);
            int next = cursor + Character.charCount(codePoint);

            if (collapseWhitespace && isWhitespace(codePoint)) {
                if (pendingSpaceStart < 0) {
                    pendingSpaceStart = cursor;
                }
                cursor = next;
                continue;
            }

            if (pendingSpaceStart >= 0) {
                if (builder.length() > 0) {
                    builder.append(' ');
                    starts = ensureCapacity(starts, size + 1);
                    ends = ensureCapacity(ends, size + 1);
                    starts[size] = pendingSpaceStart;
                    ends[size] = cursor;
                    size++;
                }
                pendingSpaceStart = -1;
            }

            int before = builder.length();
            appendFolded(builder, codePoint);
            int appended = builder.length() - before;
            starts = ensureCapacity(starts, size + appended);
            ends = ensureCapacity(ends, size + appended);
            for (int index = 0; index < appended; index++) {
                starts[size] = cursor;
                ends[size] = next;
                size++;
            }
            cursor = next;
        }

        return new NormalizedText(safeSource, builder.toString(),
            Arrays.copyOf(starts, size), Arrays.copyOf(ends, size));
    }

    /**
     * 完整的大小写折叠：先转大写再转小写，使 ß 与 SS、ς 与 σ 折叠到同一形式。
     */
    private static void appendFolded(StringBuilder builder, int codePoint) {
        if (codePoint < 0x80) {
            builder.append((char) Character.toLowerCase(codePoint));
            return;
        }
        String single = new String(Character.toChars(codePoint));
        builder.append(single.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT));
    }

    private static int[] ensureCapacity(int[] array, int required) {
        if (required <= array.length) {
            return array;
        }
        return Arrays.copyOf(array, Math.max(required, array.length * 2));
    }
}
