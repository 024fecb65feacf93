package com.textlocator.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocatorConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        LocatorConfig config = LocatorConfig.defaults();

        assertNotNull(config);
        assertEquals(Constants.MAX_FUZZY_CONTENT_LENGTH, config.getMaxFuzzyContentLength());
        assertEquals(Constants.MAX_FUZZY_QUERY_LENGTH, config.getMaxFuzzyQueryLength());
        assertEquals(Constants.MAX_STRATEGY_COST, config.getMaxStrategyCost());
        assertEquals(Constants.FUZZY_MIN_CONFIDENCE, config.getFuzzyMinConfidence());
        assertEquals(Constants.SENTENCE_MIN_QUERY_LENGTH, config.getSentenceMinQueryLength());
        assertEquals(Constants.PARTIAL_SENTENCE_MIN_FRACTION, config.getPartialSentenceMinFraction());
        assertEquals(Constants.DEFAULT_CONTEXT_RADIUS, config.getContextRadius());
        assertFalse(config.isStrictPatchValidation());
        assertEquals(Constants.MIN_PATCH_CONFIDENCE, config.getMinPatchConfidence());
        assertEquals(Constants.MIN_PATCH_LENGTH_RATIO, config.getMinPatchLengthRatio());
    }

    @Test
    void testSetters() {
        LocatorConfig config = new LocatorConfig();

        config.setMaxFuzzyContentLength(1000);
        config.setMaxFuzzyQueryLength(200);
        config.setMaxStrategyCost(5_000L);
        config.setFuzzyMinConfidence(0.75);
        config.setSentenceMinQueryLength(60);
        config.setPartialSentenceMinFraction(0.5);
        config.setContextRadius(30);
        config.setStrictPatchValidation(true);
        config.setMinPatchConfidence(0.8);
        config.setMinPatchLengthRatio(0.9);

        assertEquals(1000, config.getMaxFuzzyContentLength());
        assertEquals(200, config.getMaxFuzzyQueryLength());
        assertEquals(5_000L, config.getMaxStrategyCost());
        assertEquals(0.75, config.getFuzzyMinConfidence());
        assertEquals(60, config.getSentenceMinQueryLength());
        assertEquals(0.5, config.getPartialSentenceMinFraction());
        assertEquals(30, config.getContextRadius());
        assertTrue(config.isStrictPatchValidation());
        assertEquals(0.8, config.getMinPatchConfidence());
        assertEquals(0.9, config.getMinPatchLengthRatio());
    }

    @Test
    @DisplayName("从JSON加载：未出现的键保留默认值")
    void testLoadPartialJson() throws IOException {
        Path configFile = tempDir.resolve("locator.json");
        Files.writeString(configFile, "{\"contextRadius\": 40, \"strictPatchValidation\": true}");

        LocatorConfig config = LocatorConfig.load(configFile);

        assertEquals(40, config.getContextRadius());
        assertTrue(config.isStrictPatchValidation());
        assertEquals(Constants.MAX_FUZZY_CONTENT_LENGTH, config.getMaxFuzzyContentLength());
    }

    @Test
    @DisplayName("未知配置键直接报错")
    void testLoadRejectsUnknownKey() throws IOException {
        Path configFile = tempDir.resolve("locator.json");
        Files.writeString(configFile, "{\"fuzzyThreshold\": 0.5}");

        assertThrows(IOException.class, () -> LocatorConfig.load(configFile));
    }

    @Test
    @DisplayName("配置文件不存在时报错")
    void testLoadMissingFile() {
        assertThrows(IOException.class, () -> LocatorConfig.load(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("越界取值在加载时被拒绝")
    void testLoadRejectsOutOfRangeValue() throws IOException {
        Path configFile = tempDir.resolve("locator.json");
        Files.writeString(configFile, "{\"fuzzyMinConfidence\": 1.5}");

        assertThrows(IllegalArgumentException.class, () -> LocatorConfig.load(configFile));
    }

    @Test
    void testValidateRejectsNonPositiveLimits() {
        LocatorConfig config = new LocatorConfig();
        config.setMaxStrategyCost(0);
        assertThrows(IllegalArgumentException.class, config::validate);

        LocatorConfig negativeRadius = new LocatorConfig();
        negativeRadius.setContextRadius(-1);
        assertThrows(IllegalArgumentException.class, negativeRadius::validate);
    }
}
