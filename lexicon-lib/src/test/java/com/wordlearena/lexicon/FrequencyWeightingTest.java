package com.wordlearena.lexicon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyWeightingTest {

    @Test
    @DisplayName("equal counts → uniform distribution")
    void equalCounts() {
        Map<String, Double> p = FrequencyWeighting.sigmoid(List.of("a", "b", "c", "d"),
            Map.of("a", 7L, "b", 7L, "c", 7L, "d", 7L));
        p.values().forEach(v -> assertEquals(0.25, v, 1e-12));
    }

    @Test
    @DisplayName("matches σ(1.5·(ln(c+1) − mean)) normalized")
    void formula() {
        List<String> words = List.of("x", "y");
        Map<String, Double> p = FrequencyWeighting.sigmoid(words, Map.of("x", 0L, "y", 99L));
        double lx = Math.log(1), ly = Math.log(100), mean = (lx + ly) / 2;
        double wx = 1 / (1 + Math.exp(-1.5 * (lx - mean)));
        double wy = 1 / (1 + Math.exp(-1.5 * (ly - mean)));
        assertEquals(wx / (wx + wy), p.get("x"), 1e-12);
        assertEquals(wy / (wx + wy), p.get("y"), 1e-12);
    }

    @Test
    @DisplayName("logistic is stable on large magnitudes")
    void logisticTails() {
        assertEquals(1.0, FrequencyWeighting.logistic(1000), 1e-12);
        assertEquals(0.0, FrequencyWeighting.logistic(-1000), 1e-12);
        assertEquals(0.5, FrequencyWeighting.logistic(0), 1e-12);
    }
}
