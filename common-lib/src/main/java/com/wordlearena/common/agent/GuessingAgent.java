package com.wordlearena.common.agent;

import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GuessRecord;

import java.util.List;

/**
 * The complete surface a guessing agent exposes to the arena.
 *
 * <p>Obligations:
 * <ul>
 *   <li>{@link #guess(List)} returns a word of exactly {@code config.wordLength()} letters.</li>
 *   <li>When {@code config.allowNonWords()} is false the word must be in {@code config.vocabulary()}.</li>
 * </ul>
 * Violations are detected and penalised by the game runner, not by the agent.
 * The secret is never reachable from here; only the accumulated history is.
 *
 * <p>Implementations need a public no-arg constructor: the arena creates a fresh
 * instance for every episode, inside that episode's isolation unit.
 */
public interface GuessingAgent {

    /** Stable identity, unique across the field; used as the leaderboard key. */
    String agentId();

    /** Called once per game before the first guess. Counts toward the compute budget. */
    void beginGame(GameConfig config);

    /**
     * @param history read-only (guess, feedback) pairs so far, oldest first
     * @return the next guess
     */
    String guess(List<GuessRecord> history);
}
