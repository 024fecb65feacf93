package com.textlocator.match;

import java.util.Optional;

/**
 * 级联中的一个匹配策略：只读原文与查询，返回命中或空。
 */
@FunctionalInterface
public interface MatchStrategy {

    Optional<MatchResult> find(String content, String query);
}
