package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RoundResult(
    @JsonProperty("roundId")      String roundId,
    @JsonProperty("wordLength")   int wordLength,
    @JsonProperty("mode")         DistributionMode mode,
    @JsonProperty("repetition")   int repetition,
    @JsonProperty("seed")         long seed,
    @JsonProperty("numGames")     int numGames,
    @JsonProperty("status")       RoundStatus status,
    @JsonProperty("errorMessage") String errorMessage,
    @JsonProperty("agents")       List<AgentRoundStats> agentStats,
    @JsonProperty("games")        List<GameResult> games
) {
    public RoundResult {
        agentStats = agentStats == null ? List.of() : List.copyOf(agentStats);
        games      = games == null ? List.of() : List.copyOf(games);
    }

    @JsonIgnore
    public boolean isComplete() {
        return status == RoundStatus.COMPLETE;
    }
}
