package com.wordlearena.orchestrator.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/v1/tournaments/start}. Every field is optional;
 * null falls back to the configured {@code arena.*} default.
 *
 * rounds — ids such as {@code "5_frequency"}; empty runs the six canonical rounds
 * agents — agent ids to field; empty fields every registered agent
 */
@Data
@NoArgsConstructor
public class TournamentRequest {

    private String name;
    private Integer numGames;
    private Integer repetitions;
    private Double shock;
    private Long seed;
    private Integer maxGuesses;
    private Long gameTimeoutMs;
    private Boolean vocabOnly;
    private Integer maxVocabularySize;
    private List<String> rounds;
    private List<String> agents;
}
