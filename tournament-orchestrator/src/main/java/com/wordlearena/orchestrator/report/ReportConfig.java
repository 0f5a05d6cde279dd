package com.wordlearena.orchestrator.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** The parameters a report was produced with, including the drawn master seed. */
public record ReportConfig(
    @JsonProperty("masterSeed")        long masterSeed,
    @JsonProperty("numGames")          int numGames,
    @JsonProperty("repetitions")       int repetitions,
    @JsonProperty("shock")             double shock,
    @JsonProperty("gameTimeoutMs")     long gameTimeoutMs,
    @JsonProperty("maxGuesses")        int maxGuesses,
    @JsonProperty("allowNonWords")     boolean allowNonWords,
    @JsonProperty("maxVocabularySize") int maxVocabularySize,
    @JsonProperty("isolationMode")     String isolationMode,
    @JsonProperty("rounds")            List<String> rounds,
    @JsonProperty("agents")            List<String> agents
) {}
