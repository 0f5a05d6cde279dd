package com.wordlearena.orchestrator.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wordlearena.common.model.LeaderboardEntry;
import com.wordlearena.common.model.RoundResult;

import java.time.Instant;
import java.util.List;

public record TournamentReport(
    @JsonProperty("tournamentId") String tournamentId,
    @JsonProperty("name")         String name,
    @JsonProperty("timestamp")    Instant timestamp,
    @JsonProperty("status")       ReportStatus status,
    @JsonProperty("config")       ReportConfig config,
    @JsonProperty("rounds")       List<RoundResult> rounds,
    @JsonProperty("leaderboard")  List<LeaderboardEntry> leaderboard
) {
    public TournamentReport {
        rounds      = rounds == null ? List.of() : List.copyOf(rounds);
        leaderboard = leaderboard == null ? List.of() : List.copyOf(leaderboard);
    }
}
