package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Per-agent statistics for one round. {@code guessDistribution} is keyed by the
 * solved guess count ("1", "2", ...) plus "failed" for every unsolved game.
 */
public record AgentRoundStats(
    @JsonProperty("agentId")           String agentId,
    @JsonProperty("gamesPlayed")       int gamesPlayed,
    @JsonProperty("gamesSolved")       int gamesSolved,
    @JsonProperty("solveRate")         double solveRate,
    @JsonProperty("meanGuesses")       double meanGuesses,
    @JsonProperty("medianGuesses")     double medianGuesses,
    @JsonProperty("maxGuesses")        int maxGuesses,
    @JsonProperty("timedOut")          int timedOut,
    @JsonProperty("faulted")           int faulted,
    @JsonProperty("guessDistribution") Map<String, Integer> guessDistribution
) {}
