package com.demo.trends.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MockTrendGenerator")
class MockTrendGeneratorTest {

    private MockTrendGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new MockTrendGenerator();
    }

    // ========== Hash Tests ==========

    @Test
    @DisplayName("FNV-1a matches the reference vectors")
    void testFnv1a_ReferenceValues() {
        assertEquals(2166136261L, HashUtil.fnv1a(""));
        assertEquals(3826002220L, HashUtil.fnv1a("a"));
        assertEquals(3605271787L, HashUtil.fnv1a("linen"));
    }

    @Test
    @DisplayName("Raw score follows ((h mod 1000 mod 70) + len mod 30) / 100")
    void testRawScore() {
        assertEquals(0.22, generator.rawScore("linen"));
        assertEquals(0.49, generator.rawScore("denim"));
        assertEquals(0.11, generator.rawScore("a"));
    }

    // ========== Batch Tests ==========

    @Test
    @DisplayName("Should normalize raw scores across the batch")
    void testMockScores_Normalized() {
        Map<String, Double> out = generator.mockScores(List.of("linen", "denim", "a"));
        assertEquals(List.of("linen", "denim", "a"), List.copyOf(out.keySet()));
        assertEquals(0.289, out.get("linen"));
        assertEquals(1.0, out.get("denim"));
        assertEquals(0.0, out.get("a"));
    }

    @Test
    @DisplayName("Same category gets the same score on every call")
    void testMockScores_Deterministic() {
        List<String> cats = List.of("linen", "denim", "oversized-blazer", "athleisure");
        assertEquals(generator.mockScores(cats), generator.mockScores(cats));
        assertEquals(generator.mockScores(cats), new MockTrendGenerator().mockScores(cats));
    }

    @Test
    @DisplayName("Should collapse duplicates in first-seen order")
    void testMockScores_Duplicates() {
        Map<String, Double> out = generator.mockScores(List.of("denim", "linen", "denim"));
        assertEquals(List.of("denim", "linen"), List.copyOf(out.keySet()));
    }

    @Test
    @DisplayName("Single category normalizes to zero; empty input gives empty map")
    void testMockScores_Degenerate() {
        assertEquals(Map.of("linen", 0.0), generator.mockScores(List.of("linen")));
        assertTrue(generator.mockScores(List.of()).isEmpty());
    }
}
