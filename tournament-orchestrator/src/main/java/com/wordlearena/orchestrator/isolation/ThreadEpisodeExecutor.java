package com.wordlearena.orchestrator.isolation;

import com.wordlearena.common.model.GameOutcome;
import com.wordlearena.common.model.GameResult;
import com.wordlearena.common.trace.ArenaTraceContext;
import com.wordlearena.orchestrator.game.EpisodeRequest;
import com.wordlearena.orchestrator.game.GameRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs each episode on its own daemon thread.
 *
 * <p>On expiry the watchdog interrupts the thread and abandons it. A thread
 * that ignores interrupts keeps running until it returns, but its result is
 * discarded and, being a daemon, it never holds up JVM exit. Use
 * {@link ProcessEpisodeExecutor} when agents cannot be trusted to yield.
 */
public class ThreadEpisodeExecutor implements EpisodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ThreadEpisodeExecutor.class);

    static final Duration WATCHDOG_GRACE = Duration.ofMillis(250);

    private final GameRunner runner;

    public ThreadEpisodeExecutor(GameRunner runner) {
        this.runner = runner;
    }

    @Override
    public EpisodeHandle submit(EpisodeRequest request) {
        CompletableFuture<GameResult> result = new CompletableFuture<>();
        long submittedAt = System.nanoTime();
        Thread worker = new Thread(ArenaTraceContext.bindEpisode(request.episodeId(), () -> {
            try {
                result.complete(runner.run(request));
            } catch (Throwable t) {
                // OutOfMemoryError and friends escape the runner; the episode still gets a result
                log.warn("[Isolation] Episode thread died. episode={} agent={} err={}",
                    request.episodeId(), request.agentId(), t.toString());
                result.complete(GameResult.unsolved(request.agentId(), request.secret(), List.of(),
                    request.maxGuesses(), GameOutcome.FAULTED, elapsedMillis(submittedAt),
                    "episode unit died: " + t));
            }
        }), "episode-" + request.episodeId());
        worker.setDaemon(true);
        worker.start();
        return new ThreadEpisodeHandle(request, worker, result, submittedAt);
    }

    @Override
    public Duration watchdogTimeout(EpisodeRequest request) {
        return Duration.ofMillis(request.budgetMillis()).plus(WATCHDOG_GRACE);
    }

    @Override
    public String mode() {
        return "thread";
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static final class ThreadEpisodeHandle implements EpisodeHandle {

        private final EpisodeRequest request;
        private final Thread worker;
        private final CompletableFuture<GameResult> result;
        private final long submittedAt;

        ThreadEpisodeHandle(EpisodeRequest request, Thread worker, CompletableFuture<GameResult> result, long submittedAt) {
            this.request     = request;
            this.worker      = worker;
            this.result      = result;
            this.submittedAt = submittedAt;
        }

        @Override
        public GameResult await(Duration timeout) throws TimeoutException, InterruptedException {
            try {
                return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                // the future is only ever completed normally
                throw new IllegalStateException("episode future failed", e.getCause());
            }
        }

        @Override
        public boolean isDone() {
            return result.isDone();
        }

        @Override
        public void close() {
            if (result.isDone()) return;
            log.warn("[Isolation] Reclaiming episode thread. episode={} agent={} alive={}",
                request.episodeId(), request.agentId(), worker.isAlive());
            result.complete(GameResult.unsolved(request.agentId(), request.secret(), List.of(),
                request.maxGuesses(), GameOutcome.TIMED_OUT, elapsedMillis(submittedAt),
                "episode reclaimed by watchdog"));
            worker.interrupt();
        }
    }
}
