package com.wordlearena.orchestrator.service;

import com.wordlearena.common.exception.ConfigurationException;

import java.util.List;

/**
 * Fully resolved parameters of one tournament run.
 *
 * @param numGames          secrets per round; {@code <= 0} plays the whole vocabulary
 * @param seed              master seed, or null to draw one at start
 * @param maxVocabularySize keep only the N most frequent words; {@code <= 0} keeps all
 * @param agents            agent ids to field, or empty for every registered agent
 */
public record TournamentSettings(
    String name,
    int numGames,
    int repetitions,
    double shock,
    Long seed,
    int maxGuesses,
    long gameTimeoutMs,
    boolean allowNonWords,
    int maxVocabularySize,
    List<RoundSpec> rounds,
    List<String> agents
) {
    public TournamentSettings {
        rounds = rounds == null || rounds.isEmpty() ? RoundSpec.CANONICAL : List.copyOf(rounds);
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    /** @throws ConfigurationException for values no tournament can run with */
    public void validate() {
        if (repetitions < 1) {
            throw new ConfigurationException("repetitions must be >= 1, got " + repetitions);
        }
        if (maxGuesses < 1) {
            throw new ConfigurationException("maxGuesses must be >= 1, got " + maxGuesses);
        }
        if (gameTimeoutMs <= 0) {
            throw new ConfigurationException("gameTimeout must be positive, got " + gameTimeoutMs + " ms");
        }
        if (!(shock >= 0.0 && shock < 1.0)) {
            throw new ConfigurationException("shock must be in [0, 1), got " + shock);
        }
        for (RoundSpec spec : rounds) {
            if (spec.wordLength() < 1 || spec.mode() == null) {
                throw new ConfigurationException("Invalid round " + spec);
            }
        }
    }

    public TournamentSettings withSeed(Long newSeed) {
        return new TournamentSettings(name, numGames, repetitions, shock, newSeed, maxGuesses, gameTimeoutMs,
            allowNonWords, maxVocabularySize, rounds, agents);
    }
}
