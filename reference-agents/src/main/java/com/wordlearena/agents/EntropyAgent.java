package com.wordlearena.agents;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.matching.CandidateFilter;
import com.wordlearena.common.matching.FeedbackMatcher;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GuessRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Picks the guess whose feedback partition over the remaining candidates has
 * the highest Shannon entropy (expected information gain in bits).
 *
 * <p>Cost is bounded by sampling at most {@value #MAX_GUESS_POOL} guesses and
 * {@value #MAX_EVAL_CANDIDATES} evaluation candidates from a fixed-seed RNG,
 * so a given game always produces the same sequence of guesses.
 *
 * <p>On equal entropy a guess that is itself a candidate is preferred, since
 * it can win immediately.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class EntropyAgent implements GuessingAgent {

    private static final Logger log = LoggerFactory.getLogger(EntropyAgent.class);

    static final int MAX_GUESS_POOL      = 200;
    static final int MAX_EVAL_CANDIDATES = 500;
    static final long SAMPLING_SEED      = 42L;

    private List<String> vocabulary = List.of();
    private Random rng = new Random(SAMPLING_SEED);

    @Override
    public String agentId() { return "Entropy"; }

    @Override
    public void beginGame(GameConfig config) {
        this.vocabulary = List.copyOf(config.vocabulary());
        this.rng = new Random(SAMPLING_SEED);
    }

    @Override
    public String guess(List<GuessRecord> history) {
        List<String> candidates = CandidateFilter.filter(vocabulary, history);
        if (candidates.isEmpty()) return vocabulary.get(0);
        if (candidates.size() <= 2) return candidates.get(0);

        Set<String> candidateSet = new HashSet<>(candidates);
        List<String> guessPool = sample(candidates, MAX_GUESS_POOL);
        List<String> evalSet   = sample(candidates, MAX_EVAL_CANDIDATES);

        String best = candidates.get(0);
        double bestEntropy = -1.0;
        for (String g : guessPool) {
            double h = partitionEntropy(g, evalSet);
            boolean isCandidate = candidateSet.contains(g);
            if (h > bestEntropy || (h == bestEntropy && isCandidate && !candidateSet.contains(best))) {
                bestEntropy = h;
                best = g;
            }
        }
        log.debug("[Entropy] turn={} candidates={} guess={} bits={}",
            history.size() + 1, candidates.size(), best, String.format("%.3f", bestEntropy));
        return best;
    }

    /** Entropy in bits of the feedback-code histogram of {@code guess} over {@code evalSet}. */
    static double partitionEntropy(String guess, List<String> evalSet) {
        Map<Integer, Integer> partition = new HashMap<>();
        for (String c : evalSet) {
            partition.merge(FeedbackMatcher.score(guess, c).encode(), 1, Integer::sum);
        }
        double n = evalSet.size();
        double h = 0.0;
        for (int count : partition.values()) {
            double p = count / n;
            h -= p * (Math.log(p) / Math.log(2));
        }
        return h;
    }

    private List<String> sample(List<String> source, int limit) {
        if (source.size() <= limit) return source;
        List<String> copy = new ArrayList<>(source);
        Collections.shuffle(copy, rng);
        return copy.subList(0, limit);
    }
}
