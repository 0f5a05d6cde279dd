package com.wordlearena.orchestrator.isolation;

import com.wordlearena.orchestrator.game.EpisodeRequest;

import java.time.Duration;

/**
 * Starts episodes in isolated execution units.
 *
 * <p>Implementations must contain every failure of the unit itself (a crashed
 * thread or a dead child process) and turn it into a FAULTED result rather
 * than an exception from {@link EpisodeHandle#await}.
 */
public interface EpisodeExecutor {

    EpisodeHandle submit(EpisodeRequest request);

    /** How long the supervisor waits for a result before reclaiming the unit. */
    Duration watchdogTimeout(EpisodeRequest request);

    /** Short label for logs and status ("thread", "process"). */
    String mode();
}
