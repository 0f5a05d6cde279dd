package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Derived leaderboard row. Recomputed from the round results on every
 * aggregation; never the source of truth.
 */
public record LeaderboardEntry(
    @JsonProperty("rank")               int rank,
    @JsonProperty("agentId")            String agentId,
    @JsonProperty("totalPoints")        double totalPoints,
    @JsonProperty("roundPoints")        Map<String, Double> roundPoints,
    @JsonProperty("overallSolveRate")   double overallSolveRate,
    @JsonProperty("overallMeanGuesses") double overallMeanGuesses
) {}
