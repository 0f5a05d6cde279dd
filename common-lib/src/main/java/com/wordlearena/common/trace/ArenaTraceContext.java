package com.wordlearena.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.Optional;

/**
 * Where a log line comes from: tournament run, round, episode.
 *
 * <p>Run and round travel in the Reactor Context of the tournament pipeline
 * and reach MDC only while a log statement executes, because supervisor
 * threads are pooled and serve many rounds. The episode id is different: each
 * episode owns its thread for its whole life, so {@link #bindEpisode} keeps it
 * in that thread's MDC until the episode body returns.
 *
 * <pre>
 *     ArenaTraceContext.withRun(pipeline, runId);
 *     ArenaTraceContext.withRound(episodes, roundId);
 *     ...
 *     ArenaTraceContext.withMdc(signal.getContextView(), () -> log.info(...));
 * </pre>
 */
public final class ArenaTraceContext {

    public static final String RUN_ID_KEY  = "runId";
    public static final String ROUND_KEY   = "round";
    public static final String EPISODE_KEY = "episode";

    private static final String UNKNOWN = "unknown";

    private ArenaTraceContext() {}

    /** Stores the run id for everything upstream; call at the end of assembly. */
    public static <T> Mono<T> withRun(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Stores the round id for the episodes of one round. */
    public static <T> Flux<T> withRound(Flux<T> episodes, String roundId) {
        return episodes.contextWrite(ctx -> ctx.put(ROUND_KEY, roundId));
    }

    /** Returns the run id or {@code "unknown"}, never {@code null}. */
    public static String runId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN);
    }

    /** Empty outside a round, e.g. during start-up or report writing. */
    public static Optional<String> roundId(ContextView ctx) {
        return ctx.getOrEmpty(ROUND_KEY);
    }

    /** Bridges the run and, when present, the round of {@code ctx} into MDC for {@code logAction} only. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(runId(ctx), roundId(ctx).orElse(null), logAction);
    }

    /**
     * Same as {@link #withMdc(ContextView, Runnable)} for code that holds the
     * ids directly. A null {@code roundId} leaves the round key unset.
     */
    public static void withMdc(String runId, String roundId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        if (roundId != null) MDC.put(ROUND_KEY, roundId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
            MDC.remove(ROUND_KEY);
        }
    }

    /**
     * Wraps the body of a thread dedicated to one episode so every line it
     * logs carries {@code episodeId}.
     */
    public static Runnable bindEpisode(String episodeId, Runnable body) {
        return () -> {
            MDC.put(EPISODE_KEY, episodeId);
            try {
                body.run();
            } finally {
                MDC.remove(EPISODE_KEY);
            }
        };
    }
}
