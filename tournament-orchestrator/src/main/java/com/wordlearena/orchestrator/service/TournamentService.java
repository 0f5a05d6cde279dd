package com.wordlearena.orchestrator.service;

import com.wordlearena.common.exception.ConfigurationException;
import com.wordlearena.common.model.AgentRoundStats;
import com.wordlearena.common.model.DistributionMode;
import com.wordlearena.common.model.GameOutcome;
import com.wordlearena.common.model.GameResult;
import com.wordlearena.common.model.LeaderboardEntry;
import com.wordlearena.common.model.RoundResult;
import com.wordlearena.common.model.RoundStatus;
import com.wordlearena.common.scoring.BordaScoreCalculator;
import com.wordlearena.common.scoring.RoundStatisticsCalculator;
import com.wordlearena.common.trace.ArenaTraceContext;
import com.wordlearena.lexicon.DistributionShock;
import com.wordlearena.lexicon.Lexicon;
import com.wordlearena.lexicon.LexiconProvider;
import com.wordlearena.orchestrator.game.EpisodeRequest;
import com.wordlearena.orchestrator.isolation.EpisodeExecutor;
import com.wordlearena.orchestrator.isolation.EpisodeHandle;
import com.wordlearena.orchestrator.logger.TournamentFlowLogger;
import com.wordlearena.orchestrator.registry.AgentDescriptor;
import com.wordlearena.orchestrator.registry.AgentRegistry;
import com.wordlearena.orchestrator.report.ReportConfig;
import com.wordlearena.orchestrator.report.ReportStatus;
import com.wordlearena.orchestrator.report.TournamentReport;
import com.wordlearena.orchestrator.report.TournamentReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.util.context.ContextView;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tournaments: rounds × agents × secrets, each game in its own isolation
 * unit, then ranks the field.
 *
 * <p>Pipeline per tournament:
 * <ol>
 *   <li>Resolve the field and draw (or accept) a master seed; derive one seed per round.</li>
 *   <li>Rounds run one after another. For each round the lexicon is loaded,
 *       shocked when the round is frequency-weighted, and secrets are sampled;
 *       every agent plays the same secrets.</li>
 *   <li>Episodes fan out with {@code flatMap(…, batchWidth)}; each is supervised
 *       with a watchdog and always yields exactly one {@link GameResult}.</li>
 *   <li>Round statistics are computed once the round's flux completes; the
 *       leaderboard is recomputed from all COMPLETE rounds.</li>
 *   <li>The report is written and kept as the latest.</li>
 * </ol>
 *
 * <p>A stop signal cuts the running round (reported INCOMPLETE, not scored),
 * discards rounds not yet started and finishes the report as STOPPED.
 * Only one tournament runs at a time.
 */
@Service
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final AgentRegistry          registry;
    private final LexiconProvider        lexicons;
    private final EpisodeExecutor        executor;
    private final TournamentReportWriter reportWriter;
    private final TournamentFlowLogger   flowLogger;
    private final TournamentSettings     defaults;
    private final int                    batchWidth;

    private final TournamentState                   state    = new TournamentState();
    private final AtomicBoolean                     running  = new AtomicBoolean(false);
    private final AtomicBoolean                     stopFlag = new AtomicBoolean(false);
    private final AtomicReference<TournamentReport> latest   = new AtomicReference<>();
    private volatile Sinks.One<Boolean>             stopSignal = Sinks.one();

    public TournamentService(AgentRegistry registry,
                             LexiconProvider lexicons,
                             EpisodeExecutor executor,
                             TournamentReportWriter reportWriter,
                             TournamentFlowLogger flowLogger,
                             TournamentSettings defaults,
                             @Value("${arena.batch-width:0}") int batchWidth) {
        this.registry     = registry;
        this.lexicons     = lexicons;
        this.executor     = executor;
        this.reportWriter = reportWriter;
        this.flowLogger   = flowLogger;
        this.defaults     = defaults;
        this.batchWidth   = batchWidth > 0
            ? batchWidth
            : Math.min(Runtime.getRuntime().availableProcessors(), 4);
    }

    // ── Public API ─────────────────────────────────────────────────────────

    /**
     * Validates {@code settings}, then runs the tournament in the background.
     * Emits the state right after the run has been accepted.
     *
     * <p>Errors: {@link ConfigurationException} for invalid settings or unknown
     * agents, {@link IllegalStateException} when a tournament is already running.
     */
    public Mono<TournamentState> start(TournamentSettings settings) {
        return Mono.fromCallable(() -> prepare(settings))
            .map(run -> {
                execute(run)
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(
                        report -> {},
                        e -> log.error("[Tournament] Run failed. runId={}", run.runId(), e)
                    );
                return state;
            });
    }

    /** Runs a tournament to completion (or stop) and emits its report. */
    public Mono<TournamentReport> runTournament(TournamentSettings settings) {
        return Mono.fromCallable(() -> prepare(settings)).flatMap(this::execute);
    }

    /** Sends the stop signal to the running tournament, if any. */
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (!running.get()) {
                log.info("[Tournament] Stop requested but nothing is running.");
                return;
            }
            log.info("[Tournament] Stop requested. runId={}", state.getRunId());
            stopFlag.set(true);
            stopSignal.tryEmitValue(Boolean.TRUE);
        });
    }

    public TournamentState getState() {
        return state;
    }

    public TournamentSettings getDefaults() {
        return defaults;
    }

    public int getBatchWidth() {
        return batchWidth;
    }

    /** Most recent report of this process, else the one on disk. */
    public Optional<TournamentReport> latestReport() {
        TournamentReport report = latest.get();
        return report != null ? Optional.of(report) : reportWriter.readLatest();
    }

    // ── Run lifecycle ──────────────────────────────────────────────────────

    record TournamentRun(String runId, TournamentSettings settings, long masterSeed,
                         List<RoundPlan> plans, List<AgentDescriptor> field, Sinks.One<Boolean> stop) {}

    TournamentRun prepare(TournamentSettings settings) {
        settings.validate();
        List<AgentDescriptor> field = registry.select(settings.agents());
        if (field.isEmpty()) {
            throw new ConfigurationException("No agents registered; nothing to run");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Tournament already running. runId=" + state.getRunId());
        }

        stopFlag.set(false);
        Sinks.One<Boolean> stop = Sinks.one();
        stopSignal = stop;

        long masterSeed = settings.seed() != null
            ? settings.seed()
            : ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE);
        List<RoundPlan> plans = RoundPlan.plan(settings.rounds(), settings.repetitions(), masterSeed);
        String runId = LocalDateTime.now().format(RUN_ID_FORMAT);

        state.start(runId, settings.name(), plans.size(), field.size());
        flowLogger.logWithRunId(TournamentFlowLogger.TOURNAMENT_STARTED, runId,
            String.format("agents=%d rounds=%d masterSeed=%d batchWidth=%d isolation=%s shock=%s",
                field.size(), plans.size(), masterSeed, batchWidth, executor.mode(), settings.shock()));
        return new TournamentRun(runId, settings, masterSeed, plans, field, stop);
    }

    Mono<TournamentReport> execute(TournamentRun run) {
        Mono<TournamentReport> pipeline = Flux.fromIterable(run.plans())
            .concatMap(plan -> runRound(run, plan))
            .collectList()
            .flatMap(rounds -> finish(run, rounds))
            .doOnError(e -> {
                log.error("[Tournament] Aborted. runId={}", run.runId(), e);
                state.error(e.getMessage());
                running.set(false);
            })
            .doFinally(signal -> {
                if (signal == SignalType.CANCEL && state.isRunning()) {
                    state.stopped();
                }
                running.set(false);
            });
        return ArenaTraceContext.withRun(pipeline, run.runId());
    }

    private Mono<RoundResult> runRound(TournamentRun run, RoundPlan plan) {
        return Mono.defer(() -> {
            if (stopFlag.get()) {
                log.info("[Tournament] Round discarded after stop. round={} runId={}", plan.roundId(), run.runId());
                return Mono.empty();
            }
            TournamentSettings settings = run.settings();

            Lexicon lexicon;
            Map<String, Double> probabilities;
            List<String> secrets;
            try {
                lexicon = lexicons.load(plan.wordLength(), plan.mode(), settings.maxVocabularySize());
                probabilities = plan.mode() == DistributionMode.FREQUENCY && settings.shock() > 0.0
                    ? DistributionShock.perturb(lexicon.probabilities(), settings.shock(), plan.seed())
                    : lexicon.probabilities();
                secrets = RoundPlan.sampleSecrets(lexicon.words(), settings.numGames(), plan.seed());
            } catch (ConfigurationException e) {
                RoundResult failed = new RoundResult(plan.roundId(), plan.wordLength(), plan.mode(),
                    plan.repetition(), plan.seed(), 0, RoundStatus.FAILED, e.getMessage(), List.of(), List.of());
                state.roundDone();
                flowLogger.logRound(failed, run.runId());
                return Mono.just(failed);
            }

            List<EpisodeRequest> episodes = new ArrayList<>(run.field().size() * secrets.size());
            for (AgentDescriptor agent : run.field()) {
                for (int i = 0; i < secrets.size(); i++) {
                    episodes.add(new EpisodeRequest(
                        plan.roundId() + "-" + agent.agentId() + "-" + i,
                        agent, secrets.get(i), plan.wordLength(), plan.mode(),
                        lexicon.words(), probabilities, settings.maxGuesses(),
                        settings.allowNonWords(), settings.gameTimeoutMs()));
                }
            }

            state.beginRound(plan.roundId(), episodes.size());
            flowLogger.logWithRound(TournamentFlowLogger.ROUND_STARTED, run.runId(), plan.roundId(),
                String.format("round=%s vocabulary=%d secrets=%d episodes=%d seed=%d",
                    plan.roundId(), lexicon.size(), secrets.size(), episodes.size(), plan.seed()));

            Flux<GameResult> results = Flux.fromIterable(episodes)
                .flatMap(this::supervise, batchWidth)
                .doOnNext(result -> state.episodeDone())
                .takeUntilOther(run.stop().asMono());
            return ArenaTraceContext.withRound(results, plan.roundId())
                .collectList()
                .map(games -> assemble(plan, secrets.size(), games, episodes.size()))
                .doOnNext(round -> {
                    state.roundDone();
                    flowLogger.logRound(round, run.runId());
                });
        });
    }

    /**
     * Submits one episode and waits for it under the executor's watchdog. The
     * handle is closed on every path, including cancellation by a stop signal.
     */
    private Mono<GameResult> supervise(EpisodeRequest request) {
        return Mono.deferContextual(ctx -> Mono.using(
                () -> executor.submit(request),
                handle -> Mono.fromCallable(() -> awaitResult(handle, request, ctx)),
                EpisodeHandle::close)
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                ArenaTraceContext.withMdc(ctx, () -> log.error("[Tournament] Episode unit failed. episode={} agent={}",
                    request.episodeId(), request.agentId(), e));
                return Mono.just(GameResult.unsolved(request.agentId(), request.secret(), List.of(),
                    request.maxGuesses(), GameOutcome.FAULTED, 0L, "episode unit failed: " + e.getMessage()));
            }));
    }

    private GameResult awaitResult(EpisodeHandle handle, EpisodeRequest request, ContextView ctx) {
        Duration watchdog = executor.watchdogTimeout(request);
        long watchdogMillis = watchdog.toMillis();
        try {
            return handle.await(watchdog);
        } catch (TimeoutException e) {
            ArenaTraceContext.withMdc(ctx, () -> log.warn("[Tournament] Watchdog expired. episode={} agent={} budgetMs={}",
                request.episodeId(), request.agentId(), request.budgetMillis()));
            return GameResult.unsolved(request.agentId(), request.secret(), List.of(), request.maxGuesses(),
                GameOutcome.TIMED_OUT, watchdogMillis, "no result within " + watchdogMillis + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GameResult.unsolved(request.agentId(), request.secret(), List.of(), request.maxGuesses(),
                GameOutcome.TIMED_OUT, watchdogMillis, "supervisor interrupted");
        }
    }

    private static RoundResult assemble(RoundPlan plan, int numGames, List<GameResult> games, int expected) {
        RoundStatus status = games.size() < expected ? RoundStatus.INCOMPLETE : RoundStatus.COMPLETE;
        List<AgentRoundStats> stats = RoundStatisticsCalculator.summarize(games);
        return new RoundResult(plan.roundId(), plan.wordLength(), plan.mode(), plan.repetition(), plan.seed(),
            numGames, status, status == RoundStatus.INCOMPLETE
                ? "stopped after " + games.size() + "/" + expected + " episodes"
                : null,
            stats, games);
    }

    private Mono<TournamentReport> finish(TournamentRun run, List<RoundResult> rounds) {
        boolean stopped = stopFlag.get();
        List<LeaderboardEntry> leaderboard = BordaScoreCalculator.computeLeaderboard(rounds);
        TournamentSettings s = run.settings();

        TournamentReport report = new TournamentReport(
            run.runId(),
            s.name(),
            Instant.now(),
            stopped ? ReportStatus.STOPPED : ReportStatus.COMPLETED,
            new ReportConfig(run.masterSeed(), s.numGames(), s.repetitions(), s.shock(), s.gameTimeoutMs(),
                s.maxGuesses(), s.allowNonWords(), s.maxVocabularySize(), executor.mode(),
                s.rounds().stream().map(RoundSpec::id).toList(),
                run.field().stream().map(AgentDescriptor::agentId).toList()),
            rounds,
            leaderboard
        );

        return Mono.fromCallable(() -> reportWriter.write(report))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(path -> flowLogger.logWithRunId(TournamentFlowLogger.REPORT_WRITTEN, run.runId(), "path=" + path))
            .onErrorResume(e -> {
                log.error("[Tournament] Report could not be written; keeping it in memory. runId={}", run.runId(), e);
                return Mono.empty();
            })
            .then(Mono.fromCallable(() -> {
                latest.set(report);
                flowLogger.logLeaderboard(leaderboard, run.runId());
                if (stopped) {
                    state.stopped();
                } else {
                    state.complete();
                }
                // released before the report is emitted so a caller can start the next run at once
                running.set(false);
                return report;
            }))
            .doOnEach(flowLogger.stage(stopped
                ? TournamentFlowLogger.TOURNAMENT_STOPPED
                : TournamentFlowLogger.TOURNAMENT_COMPLETED));
    }
}
