package com.wordlearena.orchestrator.isolation;

import com.wordlearena.common.model.GameResult;

import java.time.Duration;

/** Handle for an episode whose result was known at submit time. */
public final class CompletedEpisodeHandle implements EpisodeHandle {

    private final GameResult result;

    private CompletedEpisodeHandle(GameResult result) {
        this.result = result;
    }

    public static EpisodeHandle of(GameResult result) {
        return new CompletedEpisodeHandle(result);
    }

    @Override
    public GameResult await(Duration timeout) {
        return result;
    }

    @Override
    public boolean isDone() {
        return true;
    }

    @Override
    public void close() {}
}
