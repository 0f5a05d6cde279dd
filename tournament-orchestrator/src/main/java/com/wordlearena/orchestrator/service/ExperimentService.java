package com.wordlearena.orchestrator.service;

import com.wordlearena.common.matching.CandidateFilter;
import com.wordlearena.common.model.AgentRoundStats;
import com.wordlearena.common.model.DistributionMode;
import com.wordlearena.common.model.GameResult;
import com.wordlearena.common.scoring.RoundStatisticsCalculator;
import com.wordlearena.lexicon.Lexicon;
import com.wordlearena.lexicon.LexiconProvider;
import com.wordlearena.orchestrator.dto.ExperimentRequest;
import com.wordlearena.orchestrator.game.EpisodeRequest;
import com.wordlearena.orchestrator.game.GameRunner;
import com.wordlearena.orchestrator.registry.AgentDescriptor;
import com.wordlearena.orchestrator.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Plays one agent against a sample of secrets and records, after every guess,
 * how many candidates remain and the entropy left in bits (log2 of the
 * remaining count).
 *
 * <p>Runs in-process under the game runner's deadline checks only; it is a
 * development aid, not part of tournament scoring.
 */
@Service
public class ExperimentService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    static final int  DEFAULT_WORD_LENGTH = 5;
    static final int  DEFAULT_NUM_GAMES   = 10;
    static final long DEFAULT_SEED        = 42L;

    private final AgentRegistry      registry;
    private final LexiconProvider    lexicons;
    private final GameRunner         runner;
    private final TournamentSettings defaults;

    public ExperimentService(AgentRegistry registry, LexiconProvider lexicons,
                             GameRunner runner, TournamentSettings defaults) {
        this.registry = registry;
        this.lexicons = lexicons;
        this.runner   = runner;
        this.defaults = defaults;
    }

    public Mono<ExperimentReport> run(ExperimentRequest request) {
        int numGames = request.getNumGames() != null ? request.getNumGames() : DEFAULT_NUM_GAMES;
        // generous ceiling so a hung agent cannot pin a worker forever
        Duration ceiling = Duration.ofMillis(defaults.gameTimeoutMs()).multipliedBy(Math.max(1, numGames) + 1L);
        return Mono.fromCallable(() -> runBlocking(request))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(ceiling);
    }

    ExperimentReport runBlocking(ExperimentRequest request) {
        AgentDescriptor agent = registry.find(request.getAgent());
        int wordLength = request.getWordLength() != null ? request.getWordLength() : DEFAULT_WORD_LENGTH;
        DistributionMode mode = request.getMode() != null
            ? DistributionMode.fromLabel(request.getMode())
            : DistributionMode.UNIFORM;
        int numGames   = request.getNumGames() != null ? request.getNumGames() : DEFAULT_NUM_GAMES;
        long seed      = request.getSeed() != null ? request.getSeed() : DEFAULT_SEED;
        int maxGuesses = request.getMaxGuesses() != null ? request.getMaxGuesses() : defaults.maxGuesses();
        boolean allowNonWords = request.getVocabOnly() != null ? !request.getVocabOnly() : defaults.allowNonWords();
        int maxVocabularySize = request.getMaxVocabularySize() != null
            ? request.getMaxVocabularySize() : defaults.maxVocabularySize();

        Lexicon lexicon = lexicons.load(wordLength, mode, maxVocabularySize);
        List<String> secrets = RoundPlan.sampleSecrets(lexicon.words(), Math.max(1, numGames), seed);
        log.info("[Experiment] Starting. agent={} length={} mode={} games={} seed={}",
            agent.agentId(), wordLength, mode.label(), secrets.size(), seed);

        List<ExperimentReport.Game> games = new ArrayList<>(secrets.size());
        List<GameResult> results = new ArrayList<>(secrets.size());
        for (int i = 0; i < secrets.size(); i++) {
            String secret = secrets.get(i);
            EpisodeRequest episode = new EpisodeRequest("experiment-" + agent.agentId() + "-" + i, agent, secret,
                wordLength, mode, lexicon.words(), lexicon.probabilities(), maxGuesses, allowNonWords,
                defaults.gameTimeoutMs());

            List<ExperimentReport.Step> steps = new ArrayList<>();
            AtomicReference<List<String>> candidates = new AtomicReference<>(lexicon.words());
            GameResult result = runner.run(episode, (turn, record) -> {
                List<String> remaining = CandidateFilter.filter(candidates.get(), record.word(), record.feedback());
                candidates.set(remaining);
                steps.add(new ExperimentReport.Step(record.word(), record.feedback(), remaining.size(),
                    entropyBits(remaining.size())));
            });
            results.add(result);
            games.add(new ExperimentReport.Game(i + 1, secret, result.outcome(), result.numGuesses(),
                result.failureReason(), steps));
        }

        AgentRoundStats stats = RoundStatisticsCalculator.summarize(results).get(0);
        ExperimentReport.Summary summary = new ExperimentReport.Summary(stats.gamesPlayed(), stats.gamesSolved(),
            stats.meanGuesses(), stats.medianGuesses(), stats.maxGuesses());
        log.info("[Experiment] Done. agent={} solved={}/{} mean={}",
            agent.agentId(), summary.solved(), summary.games(), String.format("%.3f", summary.meanGuesses()));
        return new ExperimentReport(agent.agentId(), wordLength, mode, seed, lexicon.size(), games, summary);
    }

    static double entropyBits(int remaining) {
        return remaining > 1 ? Math.log(remaining) / Math.log(2) : 0.0;
    }
}
