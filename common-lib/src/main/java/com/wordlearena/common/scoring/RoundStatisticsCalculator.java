package com.wordlearena.common.scoring;

import com.wordlearena.common.model.AgentRoundStats;
import com.wordlearena.common.model.GameResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates the game results of one round into per-agent statistics.
 *
 * <p>Order-independent: results may arrive in any order and the output is
 * sorted by agent id. Unsolved games contribute their penalty count
 * ({@code maxGuesses + 1}) to mean, median and max.
 */
public final class RoundStatisticsCalculator {

    public static final String FAILED_BUCKET = "failed";

    private RoundStatisticsCalculator() {}

    public static List<AgentRoundStats> summarize(List<GameResult> games) {
        Map<String, List<GameResult>> byAgent = new TreeMap<>();
        for (GameResult game : games) {
            byAgent.computeIfAbsent(game.agentId(), k -> new ArrayList<>()).add(game);
        }
        List<AgentRoundStats> stats = new ArrayList<>(byAgent.size());
        byAgent.forEach((agentId, results) -> stats.add(summarizeAgent(agentId, results)));
        return stats;
    }

    static AgentRoundStats summarizeAgent(String agentId, List<GameResult> results) {
        int n = results.size();
        int solved   = 0;
        int timedOut = 0;
        int faulted  = 0;
        int[] counts = new int[n];
        long sum = 0;
        TreeMap<Integer, Integer> solvedBuckets = new TreeMap<>();
        int failed = 0;

        for (int i = 0; i < n; i++) {
            GameResult r = results.get(i);
            counts[i] = r.numGuesses();
            sum += r.numGuesses();
            if (r.isSolved()) {
                solved++;
                solvedBuckets.merge(r.numGuesses(), 1, Integer::sum);
            } else {
                failed++;
            }
            if (r.isTimedOut()) timedOut++;
            if (r.isFaulted())  faulted++;
        }
        Arrays.sort(counts);

        Map<String, Integer> distribution = new LinkedHashMap<>();
        solvedBuckets.forEach((guesses, count) -> distribution.put(String.valueOf(guesses), count));
        if (failed > 0) {
            distribution.put(FAILED_BUCKET, failed);
        }

        double mean      = n > 0 ? (double) sum / n : 0.0;
        double solveRate = n > 0 ? (double) solved / n : 0.0;
        int max          = n > 0 ? counts[n - 1] : 0;

        return new AgentRoundStats(agentId, n, solved, solveRate, mean, median(counts), max,
            timedOut, faulted, distribution);
    }

    /** Median of an already sorted array; mean of the two middle values for even sizes. */
    static double median(int[] sorted) {
        int n = sorted.length;
        if (n == 0) return 0.0;
        if (n % 2 == 1) return sorted[n / 2];
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
