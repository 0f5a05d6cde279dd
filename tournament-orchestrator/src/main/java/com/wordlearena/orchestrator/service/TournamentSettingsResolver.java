package com.wordlearena.orchestrator.service;

import com.wordlearena.orchestrator.dto.TournamentRequest;

import java.util.List;

/** Overlays a REST request on the configured defaults. */
public final class TournamentSettingsResolver {

    private TournamentSettingsResolver() {}

    public static TournamentSettings resolve(TournamentRequest request, TournamentSettings defaults) {
        if (request == null) return defaults;
        List<RoundSpec> rounds = request.getRounds() == null || request.getRounds().isEmpty()
            ? defaults.rounds()
            : request.getRounds().stream().map(RoundSpec::parse).toList();
        return new TournamentSettings(
            request.getName() != null ? request.getName() : defaults.name(),
            orDefault(request.getNumGames(), defaults.numGames()),
            orDefault(request.getRepetitions(), defaults.repetitions()),
            request.getShock() != null ? request.getShock() : defaults.shock(),
            request.getSeed() != null ? request.getSeed() : defaults.seed(),
            orDefault(request.getMaxGuesses(), defaults.maxGuesses()),
            request.getGameTimeoutMs() != null ? request.getGameTimeoutMs() : defaults.gameTimeoutMs(),
            request.getVocabOnly() != null ? !request.getVocabOnly() : defaults.allowNonWords(),
            orDefault(request.getMaxVocabularySize(), defaults.maxVocabularySize()),
            rounds,
            request.getAgents() != null && !request.getAgents().isEmpty() ? request.getAgents() : defaults.agents()
        );
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
