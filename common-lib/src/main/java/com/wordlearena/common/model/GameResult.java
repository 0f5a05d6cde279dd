package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terminal record of one (agent, secret) episode.
 *
 * <ul>
 *   <li>{@code numGuesses} – scored guess count: the true count when solved,
 *       otherwise {@code maxGuesses + 1}.</li>
 *   <li>{@code turnsTaken} – guesses actually submitted and answered.</li>
 *   <li>{@code failureReason} – null unless FAULTED or TIMED_OUT.</li>
 * </ul>
 */
public record GameResult(
    @JsonProperty("agentId")       String agentId,
    @JsonProperty("secret")        String secret,
    @JsonProperty("guesses")       List<String> guesses,
    @JsonProperty("numGuesses")    int numGuesses,
    @JsonProperty("turnsTaken")    int turnsTaken,
    @JsonProperty("outcome")       GameOutcome outcome,
    @JsonProperty("elapsedMillis") long elapsedMillis,
    @JsonProperty("failureReason") String failureReason
) {
    public GameResult {
        guesses = guesses == null ? List.of() : List.copyOf(guesses);
    }

    public static GameResult solved(String agentId, String secret, List<String> guesses, long elapsedMillis) {
        return new GameResult(agentId, secret, guesses, guesses.size(), guesses.size(),
            GameOutcome.SOLVED, elapsedMillis, null);
    }

    public static GameResult unsolved(String agentId, String secret, List<String> guesses, int maxGuesses,
                                      GameOutcome outcome, long elapsedMillis, String failureReason) {
        if (outcome == GameOutcome.SOLVED) {
            throw new IllegalArgumentException("unsolved() cannot record a SOLVED outcome");
        }
        return new GameResult(agentId, secret, guesses, maxGuesses + 1, guesses.size(),
            outcome, elapsedMillis, failureReason);
    }

    @JsonIgnore
    public boolean isSolved() {
        return outcome == GameOutcome.SOLVED;
    }

    @JsonIgnore
    public boolean isTimedOut() {
        return outcome == GameOutcome.TIMED_OUT;
    }

    @JsonIgnore
    public boolean isFaulted() {
        return outcome == GameOutcome.FAULTED;
    }
}
