package com.textlocator.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.textlocator.config.LocatorConfig;
import com.textlocator.text.EditDistance;
import com.textlocator.text.NormalizedText;
import com.textlocator.text.Token;
import com.textlocator.text.WhitespaceTokenizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 级联定位器测试
 */
class TextLocatorTest {
    private static final String FOX = "The quick brown fox jumps over the lazy dog.";

    private final TextLocator locator = new TextLocator();

    @Test
    @DisplayName("精确命中")
    void testExactMatch() {
        MatchResult result = locator.locate(FOX, "brown fox");

        assertEquals(10, result.index());
        assertEquals(9, result.length());
        assertEquals(1.0, result.confidence());
        assertEquals(MatchKind.EXACT, result.matchType());
        assertEquals("brown fox", result.matchedText());
    }

    @Test
    @DisplayName("大小写不同时降级为忽略大小写匹配")
    void testCaseInsensitiveMatch() {
        MatchResult result = locator.locate(FOX, "QUICK BROWN");

        assertEquals(4, result.index());
        assertEquals(MatchKind.CASE_INSENSITIVE, result.matchType());
        assertEquals(0.95, result.confidence());
    }

    @Test
    @DisplayName("空白差异时使用空白归一化匹配")
    void testWhitespaceMatch() {
        String content = "The quick    brown\n\nfox jumps\tover the lazy dog.";

        MatchResult result = locator.locate(content, "quick brown fox jumps");

        assertEquals(MatchKind.NORMALIZED_WHITESPACE, result.matchType());
        assertEquals(0.85, result.confidence());
        assertEquals(4, result.index());
        assertTrue(result.matchedText().startsWith("quick"));
        assertTrue(result.matchedText().endsWith("jumps"));
    }

    @Test
    @DisplayName("排版多出的空白不影响空白归一化命中")
    void testPaddedWhitespaceQuery() {
        MatchResult result = locator.locate(FOX, "quick          brown");

        assertEquals(MatchKind.NORMALIZED_WHITESPACE, result.matchType());
        assertEquals(4, result.index());
        assertEquals("quick brown", result.matchedText());
        assertEquals(0.85, result.confidence());
    }

    @Test
    @DisplayName("跨多行换行的查询只命中引用的单词")
    void testReflowedQuery() {
        String query = "quick" + "\n".repeat(10) + "brown fox" + "\n".repeat(9) + "jumps";

        MatchResult result = locator.locate(FOX, query);

        assertEquals(MatchKind.NORMALIZED_WHITESPACE, result.matchType());
        assertEquals("quick brown fox jumps", result.matchedText());
    }

    @Test
    @DisplayName("拼写错误使用模糊匹配")
    void testFuzzyMatch() {
        MatchResult result = locator.locate(FOX, "quick bown fox jumps");

        assertEquals(MatchKind.FUZZY, result.matchType());
        assertTrue(result.confidence() >= 0.6 && result.confidence() < 1.0);
        assertEquals("quick brown fox jumps", result.matchedText());
    }

    @Test
    @DisplayName("完整句子的模糊匹配覆盖整段命中文本")
    void testFuzzyWholeSentence() {
        String content = "The quick brown fox jumped over the lazy dog yesterday.";

        MatchResult result = locator.locate(content, "quick brown fox jumps over the lazy dog");

        assertEquals(MatchKind.FUZZY, result.matchType());
        assertEquals("quick brown fox jumped over the lazy dog", result.matchedText());
    }

    @Test
    @DisplayName("较早层级命中时不再尝试后续层级")
    void testEarlierTierWins() {
        String content = "The quick brown fox jumps over the lazy dog. The fox was very clever.";
        String query = "The quick brown fox jumps over the lazy dog. The fox was extremely clever.";

        MatchResult result = locator.locate(content, query);

        // 句子匹配同样能命中，但模糊匹配层级更早
        assertEquals(MatchKind.FUZZY, result.matchType());
        assertEquals(0, result.index());
        assertEquals(content.length(), result.length());
    }

    @Test
    @DisplayName("改写过的句子使用部分句子匹配")
    void testPartialSentenceMatch() {
        String content = "Our small team quietly shipped the new search feature late on Friday night.";
        String query = "The whole team proudly released the new search tool early on Friday.";

        MatchResult result = locator.locate(content, query);

        assertEquals(MatchKind.PARTIAL_SENTENCE, result.matchType());
        assertEquals(0.5, result.confidence(), 1e-9);
        assertEquals(content.indexOf("team"), result.index());
    }

    @Test
    @DisplayName("无关查询返回未命中")
    void testNotFound() {
        MatchResult result = locator.locate(FOX, "elephant");

        assertFalse(result.found());
        assertEquals(-1, result.index());
        assertEquals(MatchKind.NO_MATCH, result.matchType());
    }

    @Test
    @DisplayName("空输入返回未命中而不是抛异常")
    void testEmptyInputs() {
        assertFalse(locator.locate("", "abc").found());
        assertFalse(locator.locate(FOX, "").found());
        assertFalse(locator.locate(null, "abc").found());
        assertFalse(locator.locate(FOX, null).found());
    }

    @Test
    @DisplayName("多次出现时返回第一次")
    void testFirstOccurrence() {
        MatchResult result = locator.locate("cat dog cat dog", "cat");

        assertEquals(0, result.index());
    }

    @Test
    @DisplayName("同一输入重复定位结果一致")
    void testDeterministic() {
        String query = "quick bown fox jumps";
        assertEquals(locator.locate(FOX, query), locator.locate(FOX, query));
    }

    @Test
    @DisplayName("命中长度不足的策略结果被丢弃，继续下一策略")
    void testShortResultRejected() {
        MatchStrategy tooShort = (content, query) ->
            Optional.of(MatchResult.of(content, 0, 1, 1.0, MatchKind.EXACT));
        MatchStrategy fallback = (content, query) ->
            Optional.of(MatchResult.of(content, 4, 4 + query.length(), 0.7, MatchKind.FUZZY));
        TextLocator custom = new TextLocator(List.of(tooShort, fallback));

        MatchResult result = custom.locate(FOX, "quick brown");

        assertEquals(MatchKind.FUZZY, result.matchType());
        assertEquals(4, result.index());
    }

    @Test
    void testLengthAdequacy() {
        MatchResult fuzzy = MatchResult.of(FOX, 0, 7, 0.7, MatchKind.FUZZY);

        assertTrue(TextLocator.isLengthAdequate(fuzzy, "012345678"));
        assertFalse(TextLocator.isLengthAdequate(fuzzy, "0123456789ab"));
        // 多余空白不计入查询长度
        assertTrue(TextLocator.isLengthAdequate(fuzzy, "0123 \n\t    4567"));
    }

    @Test
    @DisplayName("成本预算为零时只保留廉价层级")
    void testBudgetDisablesExpensiveTiers() {
        LocatorConfig config = LocatorConfig.defaults();
        config.setMaxStrategyCost(1);
        TextLocator limited = new TextLocator(config);

        assertEquals(MatchKind.EXACT, limited.locate(FOX, "lazy dog").matchType());
        assertFalse(limited.locate(FOX, "quick bown fox jumps").found());
    }

    @Test
    void testPreview() {
        assertEquals("short", TextLocator.preview("short"));
        assertEquals("a".repeat(50) + "...", TextLocator.preview("a".repeat(80)));
    }

    @Test
    @DisplayName("预览截断不拆开代理对")
    void testPreviewKeepsSurrogatePair() {
        String text = "a".repeat(49) + "\uD83D\uDE00" + "b".repeat(10);

        String preview = TextLocator.preview(text);

        assertEquals("a".repeat(49) + "...", preview);
        assertFalse(Character.isHighSurrogate(preview.charAt(48)));
    }

    @Test
    @DisplayName("随机输入下命中结果始终满足区间与长度约束")
    void testInvariantsOnRandomInputs() {
        String[] vocabulary = {"alpha", "beta", "gamma", "delta", "search", "engine", "token", "window",
            "The", "a", "of", "quick", "brown", "fox.", "Lazy", "dog!"};
        Random random = new Random(42);

        for (int round = 0; round < 200; round++) {
            String content = randomText(random, vocabulary, 20 + random.nextInt(60));
            String query;
            if (random.nextBoolean()) {
                String[] words = content.split(" ");
                int start = random.nextInt(words.length);
                int end = Math.min(words.length, start + 1 + random.nextInt(8));
                query = mutate(random, String.join(" ", Arrays.copyOfRange(words, start, end)));
            } else {
                query = randomText(random, vocabulary, 1 + random.nextInt(10));
            }

            MatchResult result = locator.locate(content, query);
            if (!result.found()) {
                assertEquals(-1, result.index());
                continue;
            }
            assertTrue(result.index() >= 0 && result.endIndex() <= content.length());
            assertEquals(content.substring(result.index(), result.endIndex()), result.matchedText());
            assertTrue(result.length() >= result.matchType().minLengthRatio() * NormalizedText.collapsedLength(query),
                "命中长度不足: " + result + " / " + query);
            assertTrue(result.confidence() > 0.0 && result.confidence() <= 1.0);
            assertTokenCoverage(result, query);
        }
    }

    /**
     * 空白归一化命中须包含全部查询词；模糊命中须覆盖至少 80% 的查询词。
     */
    private static void assertTokenCoverage(MatchResult result, String query) {
        if (result.matchType() == MatchKind.NORMALIZED_WHITESPACE) {
            String span = NormalizedText.collapseWhitespace(result.matchedText());
            for (String word : NormalizedText.collapseWhitespace(query).split(" ")) {
                assertTrue(span.contains(word), "缺少查询词 '" + word + "': " + result);
            }
        } else if (result.matchType() == MatchKind.FUZZY) {
            WhitespaceTokenizer tokenizer = new WhitespaceTokenizer();
            List<Token> queryTokens = tokenizer.tokenize(query);
            List<Token> spanTokens = tokenizer.tokenize(result.matchedText());
            int covered = 0;
            for (Token queryToken : queryTokens) {
                boolean present = spanTokens.stream()
                    .anyMatch(spanToken -> EditDistance.tokenSimilarity(queryToken.term(), spanToken.term()) > 0.0);
                if (present) {
                    covered++;
                }
            }
            assertTrue(covered >= 0.8 * queryTokens.size(), "模糊命中覆盖不足: " + result + " / " + query);
        }
    }

    @Test
    @DisplayName("同一实例可在多线程间共享")
    void testConcurrentLocate() throws Exception {
        String query = "quick bown fox jumps";
        MatchResult expected = locator.locate(FOX, query);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<MatchResult>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> locator.locate(FOX, query)));
            }
            for (Future<MatchResult> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static String randomText(Random random, String[] vocabulary, int words) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < words; i++) {
            if (i > 0) {
                builder.append(random.nextInt(10) == 0 ? "\n" : " ");
            }
            builder.append(vocabulary[random.nextInt(vocabulary.length)]);
        }
        return builder.toString();
    }

    private static String mutate(Random random, String text) {
        return switch (random.nextInt(4)) {
            case 0 -> text.toUpperCase(Locale.ROOT);
            case 1 -> text.replace(" ", "  ");
            case 2 -> text.length() > 3 ? text.substring(0, text.length() / 2) + text.substring(text.length() / 2 + 1) : text;
            default -> text;
        };
    }
}
