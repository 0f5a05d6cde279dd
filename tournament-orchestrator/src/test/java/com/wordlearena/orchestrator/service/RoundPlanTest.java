package com.wordlearena.orchestrator.service;

import com.wordlearena.common.exception.ConfigurationException;
import com.wordlearena.common.model.DistributionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoundPlanTest {

    @Nested
    @DisplayName("plan()")
    class Plan {

        @Test
        @DisplayName("canonical schedule has six rounds with plain ids")
        void canonical() {
            List<RoundPlan> plans = RoundPlan.plan(RoundSpec.CANONICAL, 1, 7L);
            assertEquals(List.of("4_uniform", "4_frequency", "5_uniform", "5_frequency", "6_uniform", "6_frequency"),
                plans.stream().map(RoundPlan::roundId).toList());
        }

        @Test
        @DisplayName("repetitions get _r suffixes, repetition-major order")
        void repetitions() {
            List<RoundPlan> plans = RoundPlan.plan(List.of(RoundSpec.parse("5_uniform"), RoundSpec.parse("4_frequency")), 2, 7L);
            assertEquals(List.of("5_uniform_r1", "4_frequency_r1", "5_uniform_r2", "4_frequency_r2"),
                plans.stream().map(RoundPlan::roundId).toList());
            assertEquals(2, plans.get(3).repetition());
        }

        @Test
        @DisplayName("same master seed → same round seeds")
        void reproducible() {
            assertEquals(RoundPlan.plan(RoundSpec.CANONICAL, 2, 99L), RoundPlan.plan(RoundSpec.CANONICAL, 2, 99L));
            assertNotEquals(RoundPlan.plan(RoundSpec.CANONICAL, 1, 99L), RoundPlan.plan(RoundSpec.CANONICAL, 1, 100L));
        }
    }

    @Nested
    @DisplayName("sampleSecrets()")
    class Sample {

        private final List<String> vocab = List.of("a", "b", "c", "d", "e", "f", "g", "h");

        @Test
        @DisplayName("samples without replacement, reproducibly")
        void sample() {
            List<String> s = RoundPlan.sampleSecrets(vocab, 5, 3L);
            assertEquals(5, s.size());
            assertEquals(5, new HashSet<>(s).size());
            assertTrue(vocab.containsAll(s));
            assertEquals(s, RoundPlan.sampleSecrets(vocab, 5, 3L));
        }

        @Test
        @DisplayName("zero or oversized counts play the whole vocabulary")
        void whole() {
            assertEquals(vocab, RoundPlan.sampleSecrets(vocab, 0, 3L));
            assertEquals(vocab, RoundPlan.sampleSecrets(vocab, 100, 3L));
        }
    }

    @Test
    @DisplayName("RoundSpec parses its own id and rejects garbage")
    void parse() {
        assertEquals(new RoundSpec(6, DistributionMode.FREQUENCY), RoundSpec.parse("6_frequency"));
        assertThrows(ConfigurationException.class, () -> RoundSpec.parse("six"));
        assertThrows(ConfigurationException.class, () -> RoundSpec.parse("x_uniform"));
        assertThrows(ConfigurationException.class, () -> RoundSpec.parse("5_zipf"));
    }
}
