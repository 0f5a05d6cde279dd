package com.wordlearena.orchestrator.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/v1/experiments}. Only {@code agent} is required. */
@Data
@NoArgsConstructor
public class ExperimentRequest {

    private String agent;
    private Integer wordLength;
    private String mode;
    private Integer numGames;
    private Long seed;
    private Integer maxGuesses;
    private Boolean vocabOnly;
    private Integer maxVocabularySize;
}
