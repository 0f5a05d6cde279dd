package com.wordlearena.common.scoring;

import com.wordlearena.common.model.AgentRoundStats;
import com.wordlearena.common.model.LeaderboardEntry;
import com.wordlearena.common.model.RoundResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stateless position-based scoring across rounds.
 *
 * <p><b>Per round</b> (N = agents in the round):
 * <pre>
 *   rank agents by meanGuesses ascending
 *   rank k (1-based) earns N − k + 1 points
 *   agents with exactly equal means share the average of the points their
 *   rank range would have earned, e.g. tied 1st/2nd of 4 → (4 + 3) / 2 = 3.5
 * </pre>
 *
 * <p><b>Across rounds</b>: points are summed over every COMPLETE round of every
 * repetition. INCOMPLETE and FAILED rounds contribute nothing. The leaderboard
 * is ordered by total points descending; equal totals share a rank and are
 * listed by agent id.
 *
 * <p>{@code overallSolveRate} and {@code overallMeanGuesses} are the means of
 * the per-round values over the rounds the agent took part in.
 */
public final class BordaScoreCalculator {

    static final double TOTAL_EPSILON = 1e-9;

    private static final Comparator<AgentRoundStats> BY_MEAN_GUESSES =
        Comparator.comparingDouble(AgentRoundStats::meanGuesses)
                  .thenComparing(AgentRoundStats::agentId);

    private BordaScoreCalculator() {}

    /**
     * Points for a single round.
     *
     * @param stats one entry per agent in the round
     * @return agentId → points; every agent is guaranteed an entry
     */
    public static Map<String, Double> roundPoints(List<AgentRoundStats> stats) {
        List<AgentRoundStats> ranked = new ArrayList<>(stats);
        ranked.sort(BY_MEAN_GUESSES);
        int n = ranked.size();

        Map<String, Double> points = new LinkedHashMap<>();
        int i = 0;
        while (i < n) {
            int j = i;
            double mean = ranked.get(i).meanGuesses();
            while (j < n && ranked.get(j).meanGuesses() == mean) {
                j++;
            }
            // positions i..j-1 are tied; position k (0-based) is worth n - k
            double sum = 0.0;
            for (int k = i; k < j; k++) {
                sum += n - k;
            }
            double shared = sum / (j - i);
            for (int k = i; k < j; k++) {
                points.put(ranked.get(k).agentId(), shared);
            }
            i = j;
        }
        return points;
    }

    /**
     * Full leaderboard over the given rounds. Only {@link RoundResult#isComplete()} rounds count.
     */
    public static List<LeaderboardEntry> computeLeaderboard(List<RoundResult> rounds) {
        Map<String, Double> totals = new TreeMap<>();
        Map<String, Map<String, Double>> perRound = new HashMap<>();
        Map<String, List<Double>> solveRates = new HashMap<>();
        Map<String, List<Double>> meanGuesses = new HashMap<>();

        for (RoundResult round : rounds) {
            if (!round.isComplete()) continue;
            roundPoints(round.agentStats()).forEach((agentId, pts) -> {
                totals.merge(agentId, pts, Double::sum);
                perRound.computeIfAbsent(agentId, k -> new LinkedHashMap<>()).put(round.roundId(), pts);
            });
            for (AgentRoundStats s : round.agentStats()) {
                solveRates.computeIfAbsent(s.agentId(), k -> new ArrayList<>()).add(s.solveRate());
                meanGuesses.computeIfAbsent(s.agentId(), k -> new ArrayList<>()).add(s.meanGuesses());
            }
        }

        List<Map.Entry<String, Double>> ordered = new ArrayList<>(totals.entrySet());
        ordered.sort(Map.Entry.<String, Double>comparingByValue().reversed()
            .thenComparing(Map.Entry.comparingByKey()));

        List<LeaderboardEntry> entries = new ArrayList<>(ordered.size());
        int rank = 0;
        double previousTotal = Double.NaN;
        for (int position = 0; position < ordered.size(); position++) {
            String agentId = ordered.get(position).getKey();
            double total   = ordered.get(position).getValue();
            if (Double.isNaN(previousTotal) || Math.abs(total - previousTotal) > TOTAL_EPSILON) {
                rank = position + 1;
            }
            previousTotal = total;
            entries.add(new LeaderboardEntry(
                rank,
                agentId,
                total,
                perRound.getOrDefault(agentId, Map.of()),
                average(solveRates.get(agentId)),
                average(meanGuesses.get(agentId))
            ));
        }
        return entries;
    }

    private static double average(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
