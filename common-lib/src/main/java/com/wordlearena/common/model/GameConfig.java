package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot handed to an agent at the start of every game.
 *
 * <p>Carries no seed and no perturbation magnitude; a shocked distribution is
 * indistinguishable from an unshocked one apart from its numbers.
 */
public record GameConfig(
    @JsonProperty("wordLength")    int wordLength,
    @JsonProperty("vocabulary")    List<String> vocabulary,
    @JsonProperty("mode")          DistributionMode mode,
    @JsonProperty("probabilities") Map<String, Double> probabilities,
    @JsonProperty("maxGuesses")    int maxGuesses,
    @JsonProperty("allowNonWords") boolean allowNonWords
) {
    /** Each game gets its own read-only copies; an agent cannot alter what another agent sees. */
    public GameConfig {
        vocabulary    = List.copyOf(vocabulary);
        probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
    }

    /** Vocabulary membership; the probability support equals the vocabulary. */
    public boolean inVocabulary(String word) {
        return probabilities.containsKey(word);
    }

    public double probabilityOf(String word) {
        return probabilities.getOrDefault(word, 0.0);
    }
}
