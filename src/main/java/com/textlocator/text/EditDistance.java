package com.textlocator.text;

import com.textlocator.config.Constants;

public final class EditDistance {

    private EditDistance() {
    }

    /**
     * 有界 Levenshtein 距离：超过 maxDistance 时提前返回 maxDistance + 1。
     */
    public static int levenshteinWithin(String left, String right, int maxDistance) {
        if (left.equals(right)) {
            return 0;
        }
        maxDistance = Math.max(0, maxDistance);
        String shorter = left.length() <= right.length() ? left : right;
        String longer = left.length() <= right.length() ? right : left;
        if (longer.length() - shorter.length() > maxDistance) {
            return maxDistance + 1;
        }
        if (shorter.isEmpty()) {
            return longer.length();
        }

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int index = 0; index <= shorter.length(); index++) {
            previous[index] = index;
        }

        for (int row = 1; row <= longer.length(); row++) {
            char longerChar = longer.charAt(row - 1);
            current[0] = row;
            int rowMin = current[0];
            for (int column = 1; column <= shorter.length(); column++) {
                int cost = shorter.charAt(column - 1) == longerChar ? 0 : 1;
                current[column] = Math.min(
                    Math.min(previous[column] + 1, current[column - 1] + 1),
                    previous[column - 1] + cost);
                rowMin = Math.min(rowMin, current[column]);
            }
            if (rowMin > maxDistance) {
                return maxDistance + 1;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        int distance = previous[shorter.length()];
        return distance > maxDistance ? maxDistance + 1 : distance;
    }

    /**
     * 两个比较键的相似度：相等为 1.0；编辑距离在允许范围内时为 1 - d / 较长长度；否则为 0。
     *
     * <p>允许距离取 2 与较长词长度 20% 中的较大者，但必须小于较短词的长度，
     * 否则 "a" 与 "to" 这类短词会互相命中。
     */
    public static double tokenSimilarity(String left, String right) {
        if (left.equals(right)) {
            return 1.0;
        }
        int shorterLength = Math.min(left.length(), right.length());
        int longerLength = Math.max(left.length(), right.length());
        int allowed = Math.max(Constants.FUZZY_MIN_EDIT_DISTANCE,
            (int) (longerLength * Constants.FUZZY_EDIT_DISTANCE_RATIO));
        allowed = Math.min(allowed, shorterLength - 1);
        if (allowed <= 0) {
            return 0.0;
        }
        int distance = levenshteinWithin(left, right, allowed);
        if (distance > allowed) {
            return 0.0;
        }
        return 1.0 - (double) distance / longerLength;
    }
}
