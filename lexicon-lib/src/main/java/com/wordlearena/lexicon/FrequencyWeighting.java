package com.wordlearena.lexicon;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw corpus counts into a probability distribution.
 *
 * <p>Frequency mode squashes log-counts through a sigmoid centred on their mean:
 * <pre>
 *   w = σ(1.5 · (ln(c + 1) − mean(ln(c + 1))))
 *   p = w / Σw
 * </pre>
 * so very common words do not swamp the distribution and rare words keep some mass.
 */
public final class FrequencyWeighting {

    static final double STEEPNESS = 1.5;

    private FrequencyWeighting() {}

    public static Map<String, Double> uniform(List<String> words) {
        Map<String, Double> probs = new LinkedHashMap<>();
        if (words.isEmpty()) return probs;
        double p = 1.0 / words.size();
        for (String w : words) probs.put(w, p);
        return probs;
    }

    /** Iteration order of the result follows {@code words}. */
    public static Map<String, Double> sigmoid(List<String> words, Map<String, Long> counts) {
        Map<String, Double> probs = new LinkedHashMap<>();
        if (words.isEmpty()) return probs;

        double[] logCounts = new double[words.size()];
        double mean = 0.0;
        for (int i = 0; i < words.size(); i++) {
            logCounts[i] = Math.log(counts.getOrDefault(words.get(i), 1L) + 1.0);
            mean += logCounts[i];
        }
        mean /= words.size();

        double total = 0.0;
        double[] weights = new double[words.size()];
        for (int i = 0; i < words.size(); i++) {
            weights[i] = logistic(STEEPNESS * (logCounts[i] - mean));
            total += weights[i];
        }
        for (int i = 0; i < words.size(); i++) {
            probs.put(words.get(i), weights[i] / total);
        }
        return probs;
    }

    /** Numerically stable on both tails. */
    static double logistic(double x) {
        if (x >= 0) return 1.0 / (1.0 + Math.exp(-x));
        double ex = Math.exp(x);
        return ex / (1.0 + ex);
    }
}
