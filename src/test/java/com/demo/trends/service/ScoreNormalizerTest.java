package com.demo.trends.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScoreNormalizer")
class ScoreNormalizerTest {

    @Test
    @DisplayName("Should scale min to 0 and max to 1 preserving order")
    void testNormalize_MinMax() {
        List<Double> out = ScoreNormalizer.normalize(List.of(10, 20, 30));
        assertEquals(List.of(0.0, 0.5, 1.0), out);
    }

    @Test
    @DisplayName("Should map degenerate input to zeros")
    void testNormalize_Degenerate() {
        assertTrue(ScoreNormalizer.normalize(List.of()).isEmpty());
        assertEquals(List.of(0.0), ScoreNormalizer.normalize(List.of(7)));
        assertEquals(List.of(0.0, 0.0, 0.0), ScoreNormalizer.normalize(List.of(3.0, 3.0, 3.0)));
    }

    @Test
    @DisplayName("Should clamp negatives and nulls to zero before scaling")
    void testNormalize_ClampsNegative() {
        List<Double> out = ScoreNormalizer.normalize(Arrays.asList(-5.0, null, 4.0, 2.0));
        assertEquals(List.of(0.0, 0.0, 1.0, 0.5), out);
    }

    @Test
    @DisplayName("Every output lies in [0,1]")
    void testNormalize_Bounds() {
        List<Double> out = ScoreNormalizer.normalize(List.of(0.3, 99.0, 1e-9, 12.5, 0.0));
        assertEquals(5, out.size());
        out.forEach(v -> assertTrue(v >= 0.0 && v <= 1.0, "out of range: " + v));
    }

    @Test
    void testRound() {
        assertEquals(0.289, ScoreNormalizer.round(0.11 / 0.38, 3));
        assertEquals(0.5, ScoreNormalizer.round(0.49996, 4));
    }
}
