package com.wordlearena.common.exception;

import java.util.Locale;

/**
 * An agent broke the arena contract. Faults the agent's episode only; the
 * round and the other agents carry on.
 */
public class AgentException extends RuntimeException {

    /** Where in an episode the agent failed. */
    public enum Phase {
        /** Class lookup or construction, before {@code beginGame}. */
        LOAD,
        /** A returned guess was rejected. */
        GUESS
    }

    private final String agentId;
    private final Phase phase;

    public AgentException(String agentId, Phase phase, String message) {
        super(message);
        this.agentId = agentId;
        this.phase   = phase;
    }

    public AgentException(String agentId, Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
        this.phase   = phase;
    }

    public String getAgentId() {
        return agentId;
    }

    public Phase getPhase() {
        return phase;
    }

    /** Text recorded as the episode's failure reason, e.g. {@code "load: ..."}. */
    public String failureReason() {
        return phase.name().toLowerCase(Locale.ROOT) + ": " + getMessage();
    }
}
