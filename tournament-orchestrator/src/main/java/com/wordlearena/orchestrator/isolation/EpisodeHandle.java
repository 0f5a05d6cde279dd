package com.wordlearena.orchestrator.isolation;

import com.wordlearena.common.model.GameResult;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A running episode inside its isolation unit.
 *
 * <p>{@link #close()} force-terminates the unit if it is still running and is
 * safe to call any number of times, including after completion.
 */
public interface EpisodeHandle extends AutoCloseable {

    /**
     * Blocks until the episode produces its result.
     *
     * @throws TimeoutException when nothing arrives within {@code timeout}; the unit keeps running until closed
     */
    GameResult await(Duration timeout) throws TimeoutException, InterruptedException;

    boolean isDone();

    @Override
    void close();
}
