package com.wordlearena.orchestrator.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wordlearena.common.model.DistributionMode;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.orchestrator.registry.AgentDescriptor;

import java.util.List;
import java.util.Map;

/**
 * One (agent, secret) game as handed to an isolation unit. Serializable so a
 * child JVM can receive it on stdin.
 */
public record EpisodeRequest(
    @JsonProperty("episodeId")     String episodeId,
    @JsonProperty("agent")         AgentDescriptor agent,
    @JsonProperty("secret")        String secret,
    @JsonProperty("wordLength")    int wordLength,
    @JsonProperty("mode")          DistributionMode mode,
    @JsonProperty("vocabulary")    List<String> vocabulary,
    @JsonProperty("probabilities") Map<String, Double> probabilities,
    @JsonProperty("maxGuesses")    int maxGuesses,
    @JsonProperty("allowNonWords") boolean allowNonWords,
    @JsonProperty("budgetMillis")  long budgetMillis
) {
    public String agentId() {
        return agent.agentId();
    }

    /** Fresh per-game view for the agent; carries no secret, seed or noise scale. */
    public GameConfig toGameConfig() {
        return new GameConfig(wordLength, vocabulary, mode, probabilities, maxGuesses, allowNonWords);
    }
}
