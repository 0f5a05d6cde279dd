package com.wordlearena.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wordlearena.common.model.DistributionMode;
import com.wordlearena.common.model.Feedback;
import com.wordlearena.common.model.GameOutcome;

import java.util.List;

/** Per-step trace of one agent playing a sample of secrets. */
public record ExperimentReport(
    @JsonProperty("agentId")    String agentId,
    @JsonProperty("wordLength") int wordLength,
    @JsonProperty("mode")       DistributionMode mode,
    @JsonProperty("seed")       long seed,
    @JsonProperty("vocabulary") int vocabularySize,
    @JsonProperty("games")      List<Game> games,
    @JsonProperty("summary")    Summary summary
) {

    public record Step(
        @JsonProperty("guess")       String guess,
        @JsonProperty("feedback")    Feedback feedback,
        @JsonProperty("remaining")   int remaining,
        @JsonProperty("entropyBits") double entropyBits
    ) {}

    public record Game(
        @JsonProperty("game")          int game,
        @JsonProperty("secret")        String secret,
        @JsonProperty("outcome")       GameOutcome outcome,
        @JsonProperty("numGuesses")    int numGuesses,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("steps")         List<Step> steps
    ) {}

    public record Summary(
        @JsonProperty("games")         int games,
        @JsonProperty("solved")        int solved,
        @JsonProperty("meanGuesses")   double meanGuesses,
        @JsonProperty("medianGuesses") double medianGuesses,
        @JsonProperty("maxGuesses")    int maxGuesses
    ) {}
}
