package com.wordlearena.orchestrator.service;

import com.wordlearena.common.model.DistributionMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * One scheduled round. The seed drives both secret sampling and the
 * distribution shock; it is drawn from {@code Random(masterSeed)} in schedule
 * order, so a master seed reproduces every round.
 */
public record RoundPlan(String roundId, RoundSpec spec, int repetition, long seed) {

    public int wordLength() {
        return spec.wordLength();
    }

    public DistributionMode mode() {
        return spec.mode();
    }

    /** Rounds in execution order: every {@link RoundSpec} of repetition 1, then repetition 2, ... */
    public static List<RoundPlan> plan(List<RoundSpec> specs, int repetitions, long masterSeed) {
        Random rng = new Random(masterSeed);
        List<RoundPlan> plans = new ArrayList<>(specs.size() * repetitions);
        for (int rep = 1; rep <= repetitions; rep++) {
            for (RoundSpec spec : specs) {
                String roundId = spec.id() + (repetitions > 1 ? "_r" + rep : "");
                plans.add(new RoundPlan(roundId, spec, rep, rng.nextInt(Integer.MAX_VALUE)));
            }
        }
        return plans;
    }

    /**
     * Samples {@code numGames} secrets without replacement. Zero, a negative
     * count or one covering the whole vocabulary plays every word.
     */
    public static List<String> sampleSecrets(List<String> vocabulary, int numGames, long seed) {
        if (numGames <= 0 || numGames >= vocabulary.size()) {
            return List.copyOf(vocabulary);
        }
        List<String> shuffled = new ArrayList<>(vocabulary);
        Collections.shuffle(shuffled, new Random(seed));
        return List.copyOf(shuffled.subList(0, numGames));
    }
}
