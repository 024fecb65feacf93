package com.textlocator.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为单词列表，偏移指向原文。
     */
    List<Token> tokenize(String text);

    /**
     * 按顺序取出比较键，供逐词比对使用。
     */
    static String[] terms(List<Token> tokens) {
        String[] terms = new String[tokens.size()];
        for (int index = 0; index < tokens.size(); index++) {
            terms[index] = tokens.get(index).term();
        }
        return terms;
    }
}
