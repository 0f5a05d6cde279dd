package com.wordlearena.orchestrator.game;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.exception.AgentException;
import com.wordlearena.common.exception.ContractViolationException;
import com.wordlearena.common.matching.FeedbackMatcher;
import com.wordlearena.common.model.Feedback;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GameOutcome;
import com.wordlearena.common.model.GameResult;
import com.wordlearena.common.model.GuessRecord;
import com.wordlearena.orchestrator.registry.AgentInstantiator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drives one game between an agent and a secret.
 *
 * <pre>
 *   Init → BeginGame → Turn* → { Solved | Exhausted | Faulted | TimedOut }
 * </pre>
 *
 * <p>A single deadline ({@code start + budget}) covers agent construction,
 * {@code beginGame} and every {@code guess}. It is checked after each call
 * returns, so an answer that arrives late is discarded even when correct.
 * An agent that never returns is the isolation unit's problem: its watchdog
 * interrupts or kills the unit and the runner reports TIMED_OUT if it
 * observes the interrupt.
 *
 * <p>Stateless and thread-safe; the result is produced exactly once per call.
 */
public class GameRunner {

    private static final Logger log = LoggerFactory.getLogger(GameRunner.class);

    private final AgentInstantiator instantiator;

    public GameRunner(AgentInstantiator instantiator) {
        this.instantiator = instantiator;
    }

    /** Builds a fresh agent from the request's descriptor and plays the game. */
    public GameResult run(EpisodeRequest request) {
        return run(request, TurnListener.NONE);
    }

    public GameResult run(EpisodeRequest request, TurnListener listener) {
        long start = System.nanoTime();
        GuessingAgent agent;
        try {
            agent = instantiator.instantiate(request.agent());
        } catch (AgentException e) {
            log.warn("[Episode] Agent rejected. episode={} agent={} phase={} err={}",
                request.episodeId(), e.getAgentId(), e.getPhase(), e.getMessage());
            return GameResult.unsolved(request.agentId(), request.secret(), List.of(), request.maxGuesses(),
                GameOutcome.FAULTED, elapsedMillis(start), e.failureReason());
        }
        return play(agent, request, start, listener);
    }

    public GameResult play(GuessingAgent agent, EpisodeRequest request) {
        return play(agent, request, System.nanoTime(), TurnListener.NONE);
    }

    public GameResult play(GuessingAgent agent, EpisodeRequest request, TurnListener listener) {
        return play(agent, request, System.nanoTime(), listener);
    }

    private GameResult play(GuessingAgent agent, EpisodeRequest request, long startNanos, TurnListener listener) {
        String agentId = request.agentId();
        String secret  = request.secret();
        int maxGuesses = request.maxGuesses();
        long deadline  = startNanos + TimeUnit.MILLISECONDS.toNanos(request.budgetMillis());

        GameConfig config = request.toGameConfig();
        List<String> guesses = new ArrayList<>();
        List<GuessRecord> history = new ArrayList<>();

        try {
            agent.beginGame(config);
            if (System.nanoTime() > deadline) {
                return timedOut(request, guesses, startNanos, "beginGame exceeded the " + request.budgetMillis() + " ms budget");
            }

            for (int turn = 1; turn <= maxGuesses; turn++) {
                if (Thread.currentThread().isInterrupted()) {
                    return timedOut(request, guesses, startNanos, "episode terminated by watchdog");
                }
                String raw = agent.guess(List.copyOf(history));
                if (System.nanoTime() > deadline) {
                    return timedOut(request, guesses, startNanos,
                        "guess " + turn + " arrived after the " + request.budgetMillis() + " ms budget");
                }

                String word = GuessValidator.validate(agentId, raw, config);
                Feedback feedback = FeedbackMatcher.score(word, secret);
                GuessRecord record = new GuessRecord(word, feedback);
                guesses.add(word);
                history.add(record);
                listener.onTurn(turn, record);

                if (feedback.isSolved()) {
                    return GameResult.solved(agentId, secret, guesses, elapsedMillis(startNanos));
                }
            }
            return GameResult.unsolved(agentId, secret, guesses, maxGuesses, GameOutcome.EXHAUSTED,
                elapsedMillis(startNanos), null);

        } catch (ContractViolationException e) {
            log.debug("[Episode] Contract violation. episode={} agent={} phase={} word={}",
                request.episodeId(), agentId, e.getPhase(), e.getOffendingWord());
            return faulted(request, guesses, startNanos, e.failureReason());
        } catch (Exception | StackOverflowError e) {
            if (Thread.currentThread().isInterrupted() || isInterruption(e)) {
                return timedOut(request, guesses, startNanos, "episode terminated by watchdog");
            }
            log.debug("[Episode] Agent raised. episode={} agent={} err={}", request.episodeId(), agentId, e.toString());
            return faulted(request, guesses, startNanos, "agent raised " + e);
        }
    }

    private static boolean isInterruption(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) return true;
        }
        return false;
    }

    private static GameResult timedOut(EpisodeRequest request, List<String> guesses, long startNanos, String reason) {
        return GameResult.unsolved(request.agentId(), request.secret(), guesses, request.maxGuesses(),
            GameOutcome.TIMED_OUT, elapsedMillis(startNanos), reason);
    }

    private static GameResult faulted(EpisodeRequest request, List<String> guesses, long startNanos, String reason) {
        return GameResult.unsolved(request.agentId(), request.secret(), guesses, request.maxGuesses(),
            GameOutcome.FAULTED, elapsedMillis(startNanos), reason);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
