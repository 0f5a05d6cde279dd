package com.wordlearena.orchestrator.logger;

import com.wordlearena.common.model.LeaderboardEntry;
import com.wordlearena.common.model.RoundResult;
import com.wordlearena.common.model.RoundStatus;
import com.wordlearena.common.trace.ArenaTraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.List;
import java.util.function.Consumer;

/**
 * Observability for the tournament lifecycle. Pure side effects; never alters
 * the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #TOURNAMENT_STARTED}</li>
 *   <li>{@link #ROUND_STARTED}, then one of {@link #ROUND_COMPLETED},
 *       {@link #ROUND_INCOMPLETE} or {@link #ROUND_FAILED}, per round</li>
 *   <li>{@link #REPORT_WRITTEN}</li>
 *   <li>{@link #TOURNAMENT_COMPLETED} or {@link #TOURNAMENT_STOPPED}</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach}, reading run and round from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(TournamentFlowLogger.TOURNAMENT_COMPLETED))
 * </pre>
 */
@Component
public class TournamentFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(TournamentFlowLogger.class);

    public static final String TOURNAMENT_STARTED   = "TOURNAMENT_STARTED";
    public static final String ROUND_STARTED        = "ROUND_STARTED";
    public static final String ROUND_COMPLETED      = "ROUND_COMPLETED";
    public static final String ROUND_INCOMPLETE     = "ROUND_INCOMPLETE";
    public static final String ROUND_FAILED         = "ROUND_FAILED";
    public static final String REPORT_WRITTEN       = "REPORT_WRITTEN";
    public static final String TOURNAMENT_COMPLETED = "TOURNAMENT_COMPLETED";
    public static final String TOURNAMENT_STOPPED   = "TOURNAMENT_STOPPED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on every
     * onNext signal. Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = ArenaTraceContext.runId(signal.getContextView());
            ArenaTraceContext.withMdc(signal.getContextView(), () ->
                log.info("[TournamentFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    public void logWithRunId(String stageName, String runId, String detail) {
        logWithRound(stageName, runId, null, detail);
    }

    /** As {@link #logWithRunId}, with the round bound in MDC as well; {@code roundId} may be null. */
    public void logWithRound(String stageName, String runId, String roundId, String detail) {
        ArenaTraceContext.withMdc(runId, roundId, () ->
            log.info("[TournamentFlow] stage={} runId={} {}", stageName, runId, detail)
        );
    }

    /** One line per round: status, game count and each agent's mean. */
    public void logRound(RoundResult round, String runId) {
        String stageName = switch (round.status()) {
            case COMPLETE   -> ROUND_COMPLETED;
            case INCOMPLETE -> ROUND_INCOMPLETE;
            case FAILED     -> ROUND_FAILED;
        };
        StringBuilder means = new StringBuilder();
        round.agentStats().forEach(s -> means.append(s.agentId()).append('=')
            .append(String.format("%.3f", s.meanGuesses())).append(' '));
        ArenaTraceContext.withMdc(runId, round.roundId(), () -> {
            if (round.status() == RoundStatus.FAILED) {
                log.warn("[TournamentFlow] stage={} round={} runId={} error={}",
                    stageName, round.roundId(), runId, round.errorMessage());
            } else {
                log.info("[TournamentFlow] stage={} round={} games={} seed={} runId={} means: {}",
                    stageName, round.roundId(), round.games().size(), round.seed(), runId, means.toString().trim());
            }
        });
    }

    /** Leaderboard as a fixed-width table. */
    public void logLeaderboard(List<LeaderboardEntry> leaderboard, String runId) {
        StringBuilder sb = new StringBuilder("\n");
        sb.append(String.format("  %-6s%-25s%8s%8s%8s%n", "Rank", "Agent", "Points", "Solve%", "MeanG"));
        sb.append("  ").append("-".repeat(55)).append('\n');
        for (LeaderboardEntry e : leaderboard) {
            sb.append(String.format("  %-6d%-25s%8.1f%7.1f%%%8.2f%n",
                e.rank(), e.agentId(), e.totalPoints(), e.overallSolveRate() * 100.0, e.overallMeanGuesses()));
        }
        ArenaTraceContext.withMdc(runId, null, () -> log.info("[TournamentFlow] Leaderboard runId={}{}", runId, sb));
    }
}
