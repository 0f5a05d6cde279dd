package com.wordlearena.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wordlearena.agents.RandomAgent;
import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.exception.ConfigurationException;
import com.wordlearena.common.model.AgentRoundStats;
import com.wordlearena.common.model.DistributionMode;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GuessRecord;
import com.wordlearena.common.model.LeaderboardEntry;
import com.wordlearena.common.model.RoundResult;
import com.wordlearena.common.model.RoundStatus;
import com.wordlearena.common.scoring.BordaScoreCalculator;
import com.wordlearena.lexicon.Lexicon;
import com.wordlearena.lexicon.LexiconException;
import com.wordlearena.lexicon.LexiconProvider;
import com.wordlearena.orchestrator.game.EpisodeRequest;
import com.wordlearena.orchestrator.game.GameRunner;
import com.wordlearena.orchestrator.isolation.CompletedEpisodeHandle;
import com.wordlearena.orchestrator.isolation.EpisodeExecutor;
import com.wordlearena.orchestrator.isolation.EpisodeHandle;
import com.wordlearena.orchestrator.isolation.ThreadEpisodeExecutor;
import com.wordlearena.orchestrator.logger.TournamentFlowLogger;
import com.wordlearena.orchestrator.registry.AgentInstantiator;
import com.wordlearena.orchestrator.registry.AgentRegistry;
import com.wordlearena.orchestrator.report.ReportStatus;
import com.wordlearena.orchestrator.report.TournamentReport;
import com.wordlearena.orchestrator.report.TournamentReportWriter;
import com.wordlearena.orchestrator.support.Episodes;
import com.wordlearena.orchestrator.support.TestAgents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TournamentServiceTest {

    @TempDir
    Path resultsDir;

    /** Four-letter rounds only; any other length has no corpus. */
    private static final LexiconProvider LEXICONS = (wordLength, mode, maxVocabularySize) -> {
        if (wordLength != 4) {
            throw new LexiconException("No corpus for word length " + wordLength);
        }
        Map<String, Double> probabilities = mode == DistributionMode.UNIFORM
            ? Episodes.uniform(Episodes.VOCAB)
            : frequency();
        return new Lexicon(4, mode, Episodes.VOCAB, probabilities);
    };

    private static Map<String, Double> frequency() {
        Map<String, Double> p = new LinkedHashMap<>();
        double[] weights = {0.30, 0.25, 0.15, 0.12, 0.10, 0.08};
        for (int i = 0; i < Episodes.VOCAB.size(); i++) p.put(Episodes.VOCAB.get(i), weights[i]);
        return p;
    }

    /** Records every submitted episode, then delegates to a real thread executor. */
    static final class RecordingExecutor implements EpisodeExecutor {
        final List<EpisodeRequest> submitted = Collections.synchronizedList(new ArrayList<>());
        private final ThreadEpisodeExecutor delegate = new ThreadEpisodeExecutor(new GameRunner(new AgentInstantiator()));

        @Override
        public EpisodeHandle submit(EpisodeRequest request) {
            submitted.add(request);
            return delegate.submit(request);
        }

        @Override
        public Duration watchdogTimeout(EpisodeRequest request) {
            return delegate.watchdogTimeout(request);
        }

        @Override
        public String mode() {
            return delegate.mode();
        }
    }

    /** Knows the secret; only reachable through {@link OracleExecutor}, which hands it over. */
    public static class OracleAgent implements GuessingAgent {
        private final String secret;

        public OracleAgent() { this(null); }

        OracleAgent(String secret) { this.secret = secret; }

        @Override public String agentId() { return "Oracle"; }

        @Override public void beginGame(GameConfig config) {}

        @Override public String guess(List<GuessRecord> history) { return secret; }
    }

    /** Plays Oracle episodes in-line with the secret; everything else goes to the recording executor. */
    static final class OracleExecutor implements EpisodeExecutor {
        private final RecordingExecutor delegate;
        private final GameRunner runner = new GameRunner(new AgentInstantiator());

        OracleExecutor(RecordingExecutor delegate) {
            this.delegate = delegate;
        }

        @Override
        public EpisodeHandle submit(EpisodeRequest request) {
            if ("Oracle".equals(request.agentId())) {
                return CompletedEpisodeHandle.of(runner.play(new OracleAgent(request.secret()), request));
            }
            return delegate.submit(request);
        }

        @Override
        public Duration watchdogTimeout(EpisodeRequest request) {
            return delegate.watchdogTimeout(request);
        }

        @Override
        public String mode() {
            return delegate.mode();
        }
    }

    private RecordingExecutor executor;

    private TournamentService service(List<GuessingAgent> agents, int batchWidth) {
        executor = new RecordingExecutor();
        return service(agents, batchWidth, executor);
    }

    private TournamentService service(List<GuessingAgent> agents, int batchWidth, EpisodeExecutor episodes) {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new TournamentService(
            new AgentRegistry(agents, List.of(), Set.of()),
            LEXICONS,
            episodes,
            new TournamentReportWriter(mapper, resultsDir),
            new TournamentFlowLogger(),
            settings(List.of("4_uniform"), 0, 0.0),
            batchWidth);
    }

    private static List<GuessingAgent> field() {
        return List.of(new TestAgents.FilterAgent(), new TestAgents.StubbornAgent(), new TestAgents.OffLengthAgent());
    }

    private static TournamentSettings settings(List<String> rounds, int numGames, double shock) {
        return new TournamentSettings("test", numGames, 1, shock, 5L, 6, 2_000, false, 0,
            rounds.stream().map(RoundSpec::parse).toList(), List.of());
    }

    @Nested
    @DisplayName("complete run")
    class CompleteRun {

        @Test
        @DisplayName("every agent plays every secret; Borda points rank the field")
        void ranksField() {
            TournamentService service = service(field(), 2);
            TournamentReport report = service.runTournament(settings(List.of("4_uniform", "4_frequency"), 0, 0.0)).block();

            assertNotNull(report);
            assertEquals(ReportStatus.COMPLETED, report.status());
            assertEquals(2, report.rounds().size());
            for (RoundResult round : report.rounds()) {
                assertEquals(RoundStatus.COMPLETE, round.status());
                assertEquals(6, round.numGames());
                assertEquals(18, round.games().size());
                assertEquals(3, round.agentStats().size());
            }

            List<LeaderboardEntry> board = report.leaderboard();
            assertEquals(List.of("Filter", "Stubborn", "OffLength"),
                board.stream().map(LeaderboardEntry::agentId).toList());
            assertEquals(6.0, board.get(0).totalPoints(), 1e-9);
            assertEquals(4.0, board.get(1).totalPoints(), 1e-9);
            assertEquals(2.0, board.get(2).totalPoints(), 1e-9);
            assertEquals(List.of(1, 2, 3), board.stream().map(LeaderboardEntry::rank).toList());
            // N(N+1)/2 per complete round
            assertEquals(12.0, board.stream().mapToDouble(LeaderboardEntry::totalPoints).sum(), 1e-9);

            assertEquals(1.0, board.get(0).overallSolveRate(), 1e-9);
            assertEquals(0.0, board.get(2).overallSolveRate(), 1e-9);
        }

        @Test
        @DisplayName("oracle, random and invalid-word agents: oracle leads, invalid trails, points sum to N(N+1)/2")
        void oracleRandomInvalid() {
            executor = new RecordingExecutor();
            TournamentService service = service(
                List.of(new OracleAgent(), new RandomAgent(), new TestAgents.OffLengthAgent()), 2,
                new OracleExecutor(executor));
            TournamentReport report = service.runTournament(settings(List.of("4_uniform", "4_frequency"), 0, 0.0)).block();

            for (RoundResult round : report.rounds()) {
                assertEquals(RoundStatus.COMPLETE, round.status());
                Map<String, AgentRoundStats> stats = round.agentStats().stream()
                    .collect(Collectors.toMap(AgentRoundStats::agentId, st -> st));
                assertEquals(1.0, stats.get("Oracle").meanGuesses(), 1e-9);
                assertEquals(6, stats.get("OffLength").faulted());
                assertEquals(1.0, stats.get("Random").solveRate(), 1e-9);
                assertEquals(6.0, BordaScoreCalculator.roundPoints(round.agentStats()).values().stream()
                    .mapToDouble(Double::doubleValue).sum(), 1e-9);
            }

            List<LeaderboardEntry> board = report.leaderboard();
            assertEquals(12.0, board.stream().mapToDouble(LeaderboardEntry::totalPoints).sum(), 1e-9);
            assertEquals("Oracle", board.get(0).agentId());
            assertEquals(1, board.get(0).rank());
            LeaderboardEntry invalid = board.get(board.size() - 1);
            assertEquals("OffLength", invalid.agentId());
            assertEquals(2.0, invalid.totalPoints(), 1e-9);
        }

        @Test
        @DisplayName("report is persisted and served as latest; state ends COMPLETED")
        void persisted() {
            TournamentService service = service(field(), 2);
            TournamentReport report = service.runTournament(settings(List.of("4_uniform"), 2, 0.0)).block();

            assertTrue(Files.isRegularFile(resultsDir.resolve("runs").resolve(report.tournamentId())
                .resolve("tournament_results.json")));
            assertTrue(Files.isRegularFile(resultsDir.resolve("latest.json")));
            assertEquals(report.tournamentId(), service.latestReport().orElseThrow().tournamentId());
            assertEquals(TournamentState.Status.COMPLETED, service.getState().getStatus());
            assertEquals(5L, report.config().masterSeed());
            assertEquals("thread", report.config().isolationMode());
        }

        @Test
        @DisplayName("all agents face the same sampled secrets, and the same seed samples them again")
        void sharedAndReproducibleSecrets() {
            TournamentService service = service(field(), 2);
            service.runTournament(settings(List.of("4_uniform"), 3, 0.0)).block();
            Map<String, Set<String>> first = secretsByAgent(executor.submitted);

            assertEquals(3, first.size());
            Set<String> secrets = first.get("Filter");
            assertEquals(3, secrets.size());
            first.values().forEach(s -> assertEquals(secrets, s));

            service.runTournament(settings(List.of("4_uniform"), 3, 0.0)).block();
            Map<String, Set<String>> second = secretsByAgent(executor.submitted.subList(9, 18));
            assertEquals(secrets, second.get("Filter"));
        }

        @Test
        @DisplayName("shock perturbs frequency rounds only")
        void shockScope() {
            TournamentService service = service(List.of(new TestAgents.FilterAgent()), 1);
            service.runTournament(settings(List.of("4_uniform", "4_frequency"), 1, 0.3)).block();

            EpisodeRequest uniform = executor.submitted.stream()
                .filter(r -> r.mode() == DistributionMode.UNIFORM).findFirst().orElseThrow();
            EpisodeRequest shocked = executor.submitted.stream()
                .filter(r -> r.mode() == DistributionMode.FREQUENCY).findFirst().orElseThrow();

            assertEquals(Episodes.uniform(Episodes.VOCAB), uniform.probabilities());
            assertNotEquals(frequency(), shocked.probabilities());
            assertEquals(frequency().keySet(), shocked.probabilities().keySet());
            assertEquals(1.0, shocked.probabilities().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        }

        @Test
        @DisplayName("an agent that tries to clear its distribution cannot affect the other agents")
        void distributionIsolatedPerEpisode() {
            TournamentService service = service(
                List.of(new TestAgents.MapClearingAgent(), new TestAgents.FilterAgent()), 1);
            TournamentReport report = service.runTournament(settings(List.of("4_frequency"), 0, 0.2)).block();

            Map<String, AgentRoundStats> stats = report.rounds().get(0).agentStats().stream()
                .collect(Collectors.toMap(AgentRoundStats::agentId, st -> st));
            assertEquals(6, stats.get("Filter").gamesSolved());
            assertEquals(0, stats.get("Filter").faulted());
            assertEquals(6, stats.get("MapClearing").faulted());
            executor.submitted.forEach(r -> assertEquals(Episodes.VOCAB.size(), r.probabilities().size()));
        }

        private Map<String, Set<String>> secretsByAgent(List<EpisodeRequest> requests) {
            return requests.stream().collect(Collectors.groupingBy(EpisodeRequest::agentId,
                Collectors.mapping(EpisodeRequest::secret, Collectors.toSet())));
        }
    }

    @Nested
    @DisplayName("failures and control")
    class FailuresAndControl {

        @Test
        @DisplayName("round without a corpus is FAILED and does not score")
        void failedRound() {
            TournamentService service = service(field(), 2);
            TournamentReport report = service.runTournament(settings(List.of("5_uniform", "4_uniform"), 2, 0.0)).block();

            assertEquals(RoundStatus.FAILED, report.rounds().get(0).status());
            assertNotNull(report.rounds().get(0).errorMessage());
            assertEquals(RoundStatus.COMPLETE, report.rounds().get(1).status());
            assertEquals(Map.of("4_uniform", 3.0), report.leaderboard().get(0).roundPoints());
        }

        @Test
        @DisplayName("unknown agent and invalid settings are rejected before anything runs")
        void rejected() {
            TournamentService service = service(field(), 2);
            TournamentSettings unknown = new TournamentSettings("t", 1, 1, 0.0, 5L, 6, 2_000, false, 0,
                null, List.of("Nobody"));
            assertThrows(ConfigurationException.class, () -> service.runTournament(unknown).block());
            assertThrows(ConfigurationException.class,
                () -> service.runTournament(settings(List.of("4_uniform"), 1, 1.5)).block());
            assertFalse(service.getState().isRunning());
        }

        @Test
        @DisplayName("stop cuts the running round to INCOMPLETE and discards the rest")
        void stop() throws Exception {
            TournamentService service = service(List.of(new TestAgents.SleepyFilterAgent()), 1);
            service.start(settings(List.of("4_uniform", "4_frequency"), 0, 0.0)).block();
            assertTrue(service.getState().isRunning());

            Thread.sleep(3 * TestAgents.SleepyFilterAgent.DELAY_MS);
            service.stop().block();
            awaitIdle(service);

            TournamentReport report = service.latestReport().orElseThrow();
            assertEquals(ReportStatus.STOPPED, report.status());
            assertEquals(1, report.rounds().size());
            assertEquals(RoundStatus.INCOMPLETE, report.rounds().get(0).status());
            assertTrue(report.rounds().get(0).games().size() < 6);
            assertTrue(report.leaderboard().isEmpty());
            assertEquals(TournamentState.Status.STOPPED, service.getState().getStatus());
        }

        @Test
        @DisplayName("second tournament while one is running → IllegalStateException")
        void alreadyRunning() throws Exception {
            TournamentService service = service(List.of(new TestAgents.SleepyFilterAgent()), 1);
            service.start(settings(List.of("4_uniform", "4_frequency"), 0, 0.0)).block();

            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> service.runTournament(settings(List.of("4_uniform"), 1, 0.0)).block());
            assertTrue(e.getMessage().contains("already running"));

            service.stop().block();
            awaitIdle(service);
        }

        private void awaitIdle(TournamentService service) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 10_000;
            while (service.getState().isRunning() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertFalse(service.getState().isRunning(), "tournament did not wind down");
        }
    }
}
