package com.wordlearena.lexicon;

import com.wordlearena.common.model.DistributionMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loaded vocabulary for one word length plus the probability of every word.
 *
 * <p>{@code words} is sorted and duplicate-free. The key set of
 * {@code probabilities} equals {@code words} and the values sum to 1.
 */
public record Lexicon(
    int wordLength,
    DistributionMode mode,
    List<String> words,
    Map<String, Double> probabilities
) {
    public Lexicon {
        words = List.copyOf(words);
        probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
        if (!probabilities.keySet().containsAll(words) || probabilities.size() != words.size()) {
            throw new IllegalArgumentException("probability support must equal the vocabulary");
        }
    }

    public int size() {
        return words.size();
    }

    public boolean contains(String word) {
        return probabilities.containsKey(word);
    }

    /** Same vocabulary, different numbers. Used after a distribution shock. */
    public Lexicon withProbabilities(Map<String, Double> replacement) {
        return new Lexicon(wordLength, mode, words, replacement);
    }
}
