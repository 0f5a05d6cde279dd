package com.wordlearena.lexicon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Multiplicative white-noise perturbation of a probability distribution.
 *
 * <pre>
 *   p_i ← max(p_i · (1 + U(−ε, ε)), 1e−12)
 *   p_i ← p_i / Σp
 * </pre>
 *
 * <p>Noise is drawn in sorted word order from {@code new Random(seed)}, so the
 * same (distribution, ε, seed) always yields the same result whatever the
 * iteration order of the input map.
 */
public final class DistributionShock {

    static final double FLOOR = 1e-12;

    private DistributionShock() {}

    /**
     * @param epsilon noise magnitude in [0, 1); zero returns the input numbers unchanged
     * @return a new read-only map; the input is never modified
     * @throws IllegalArgumentException for ε outside [0, 1)
     */
    public static Map<String, Double> perturb(Map<String, Double> probabilities, double epsilon, long seed) {
        if (!(epsilon >= 0.0 && epsilon < 1.0)) {
            throw new IllegalArgumentException("shock epsilon must be in [0, 1), got " + epsilon);
        }
        if (epsilon == 0.0) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
        }

        Random rng = new Random(seed);
        Map<String, Double> sorted = new TreeMap<>(probabilities);
        Map<String, Double> perturbed = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> e : sorted.entrySet()) {
            double factor = 1.0 + (rng.nextDouble() * 2.0 - 1.0) * epsilon;
            double p = Math.max(e.getValue() * factor, FLOOR);
            perturbed.put(e.getKey(), p);
            total += p;
        }
        final double sum = total;
        perturbed.replaceAll((w, p) -> p / sum);
        return Collections.unmodifiableMap(perturbed);
    }
}
