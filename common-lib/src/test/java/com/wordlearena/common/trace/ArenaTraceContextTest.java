package com.wordlearena.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ArenaTraceContextTest {

    @Nested
    @DisplayName("Reactor Context")
    class ReactorContext {

        @Test
        @DisplayName("round pipelines inside a run see both ids")
        void runAndRound() {
            Flux<String> episodes = Flux.just("e1", "e2")
                .flatMap(e -> Mono.deferContextual(ctx ->
                    Mono.just(ArenaTraceContext.runId(ctx) + "/" + ArenaTraceContext.roundId(ctx).orElse("-") + "/" + e)));

            List<String> seen = ArenaTraceContext.withRun(
                ArenaTraceContext.withRound(episodes, "5_uniform").collectList(), "20261019-120000").block();

            assertEquals(List.of("20261019-120000/5_uniform/e1", "20261019-120000/5_uniform/e2"), seen);
        }

        @Test
        @DisplayName("missing ids: run is unknown, round is empty")
        void defaults() {
            assertEquals("unknown", ArenaTraceContext.runId(Context.empty()));
            assertEquals(Optional.empty(), ArenaTraceContext.roundId(Context.empty()));
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("ids are visible only while the log action runs")
        void scopedToLogAction() {
            AtomicReference<String> run = new AtomicReference<>();
            AtomicReference<String> round = new AtomicReference<>();
            ArenaTraceContext.withMdc(Context.of(ArenaTraceContext.RUN_ID_KEY, "r1", ArenaTraceContext.ROUND_KEY, "4_frequency_r2"),
                () -> {
                    run.set(MDC.get(ArenaTraceContext.RUN_ID_KEY));
                    round.set(MDC.get(ArenaTraceContext.ROUND_KEY));
                });

            assertEquals("r1", run.get());
            assertEquals("4_frequency_r2", round.get());
            assertNull(MDC.get(ArenaTraceContext.RUN_ID_KEY));
            assertNull(MDC.get(ArenaTraceContext.ROUND_KEY));
        }

        @Test
        @DisplayName("null round leaves the round key unset")
        void runOnly() {
            AtomicReference<String> round = new AtomicReference<>("set");
            ArenaTraceContext.withMdc("r1", null, () -> round.set(MDC.get(ArenaTraceContext.ROUND_KEY)));
            assertNull(round.get());
        }

        @Test
        @DisplayName("episode id stays bound for the whole episode body, then is cleared")
        void episodeBinding() throws Exception {
            List<String> seen = new ArrayList<>();
            AtomicReference<String> after = new AtomicReference<>("set");
            Thread t = new Thread(() -> {
                ArenaTraceContext.bindEpisode("4_uniform-Filter-3", () -> {
                    seen.add(MDC.get(ArenaTraceContext.EPISODE_KEY));
                    seen.add(MDC.get(ArenaTraceContext.EPISODE_KEY));
                }).run();
                after.set(MDC.get(ArenaTraceContext.EPISODE_KEY));
            });
            t.start();
            t.join();

            assertEquals(List.of("4_uniform-Filter-3", "4_uniform-Filter-3"), seen);
            assertNull(after.get());
        }
    }
}
