package com.wordlearena.common.scoring;

import com.wordlearena.common.model.AgentRoundStats;
import com.wordlearena.common.model.GameOutcome;
import com.wordlearena.common.model.GameResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoundStatisticsCalculatorTest {

    @Test
    @DisplayName("solved and unsolved games aggregate with the max+1 penalty")
    void mixedOutcomes() {
        List<GameResult> games = List.of(
            solved("a", 3),
            solved("a", 4),
            GameResult.unsolved("a", "perro", List.of("aaaaa"), 6, GameOutcome.EXHAUSTED, 5, null),
            GameResult.unsolved("a", "canto", List.of(), 6, GameOutcome.TIMED_OUT, 5000, "deadline exceeded"));

        AgentRoundStats s = RoundStatisticsCalculator.summarize(games).get(0);
        assertEquals(4, s.gamesPlayed());
        assertEquals(2, s.gamesSolved());
        assertEquals(0.5, s.solveRate(), 1e-9);
        assertEquals((3 + 4 + 7 + 7) / 4.0, s.meanGuesses(), 1e-9);
        assertEquals(5.5, s.medianGuesses(), 1e-9);
        assertEquals(7, s.maxGuesses());
        assertEquals(1, s.timedOut());
        assertEquals(0, s.faulted());
        assertEquals(List.of("3", "4", RoundStatisticsCalculator.FAILED_BUCKET),
            new ArrayList<>(s.guessDistribution().keySet()));
        assertEquals(2, s.guessDistribution().get(RoundStatisticsCalculator.FAILED_BUCKET));
    }

    @Test
    @DisplayName("output is sorted by agent id and independent of input order")
    void orderIndependent() {
        List<GameResult> games = new ArrayList<>(List.of(
            solved("b", 2), solved("a", 5), solved("b", 4), solved("a", 1), solved("c", 3)));
        List<AgentRoundStats> first = RoundStatisticsCalculator.summarize(games);
        Collections.reverse(games);
        List<AgentRoundStats> second = RoundStatisticsCalculator.summarize(games);

        assertEquals(List.of("a", "b", "c"), first.stream().map(AgentRoundStats::agentId).toList());
        assertEquals(first, second);
    }

    @Test
    @DisplayName("median of odd and even sized samples")
    void median() {
        assertEquals(3.0, RoundStatisticsCalculator.median(new int[]{1, 3, 6}), 1e-9);
        assertEquals(4.5, RoundStatisticsCalculator.median(new int[]{1, 4, 5, 9}), 1e-9);
        assertEquals(0.0, RoundStatisticsCalculator.median(new int[0]), 1e-9);
    }

    private static GameResult solved(String agentId, int guesses) {
        return GameResult.solved(agentId, "x", Collections.nCopies(guesses, "x"), 1);
    }
}
