package com.wordlearena.orchestrator.support;

import com.wordlearena.common.agent.GuessingAgent;
import com.wordlearena.common.matching.CandidateFilter;
import com.wordlearena.common.model.GameConfig;
import com.wordlearena.common.model.GuessRecord;
import com.wordlearena.common.trace.ArenaTraceContext;
import com.wordlearena.orchestrator.registry.AgentDescriptor;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/** Deterministic agents for runner, executor and tournament tests. */
public final class TestAgents {

    private TestAgents() {}

    public static AgentDescriptor descriptor(Class<? extends GuessingAgent> type) {
        try {
            return AgentDescriptor.classpath(type.getDeclaredConstructor().newInstance().agentId(), type.getName());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Guesses the first candidate still consistent with the history. Always solves given enough turns. */
    public static class FilterAgent implements GuessingAgent {
        private List<String> vocabulary;

        @Override public String agentId() { return "Filter"; }

        @Override public void beginGame(GameConfig config) { vocabulary = config.vocabulary(); }

        @Override
        public String guess(List<GuessRecord> history) {
            List<String> candidates = CandidateFilter.filter(vocabulary, history);
            return candidates.isEmpty() ? vocabulary.get(0) : candidates.get(0);
        }
    }

    /** {@link FilterAgent} that takes {@link #DELAY_MS} per guess. */
    public static class SleepyFilterAgent extends FilterAgent {
        public static final long DELAY_MS = 100;

        @Override public String agentId() { return "SleepyFilter"; }

        @Override
        public String guess(List<GuessRecord> history) {
            try {
                Thread.sleep(DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.guess(history);
        }
    }

    /** Repeats the first vocabulary word. Solves only that secret. */
    public static class StubbornAgent implements GuessingAgent {
        private String word;

        @Override public String agentId() { return "Stubborn"; }

        @Override public void beginGame(GameConfig config) { word = config.vocabulary().get(0); }

        @Override public String guess(List<GuessRecord> history) { return word; }
    }

    /** Wipes the distribution it was handed before the first guess. */
    public static class MapClearingAgent implements GuessingAgent {
        private String word;

        @Override public String agentId() { return "MapClearing"; }

        @Override
        public void beginGame(GameConfig config) {
            word = config.vocabulary().get(0);
            config.probabilities().clear();
        }

        @Override public String guess(List<GuessRecord> history) { return word; }
    }

    /** Remembers the episode id its thread logs under, then plays like {@link StubbornAgent}. */
    public static class EpisodeTaggedAgent implements GuessingAgent {
        public static final AtomicReference<String> SEEN = new AtomicReference<>();
        private String word;

        @Override public String agentId() { return "EpisodeTagged"; }

        @Override
        public void beginGame(GameConfig config) {
            SEEN.set(MDC.get(ArenaTraceContext.EPISODE_KEY));
            word = config.vocabulary().get(0);
        }

        @Override public String guess(List<GuessRecord> history) { return word; }
    }

    /** Kills its JVM on the first guess. Only meaningful in a child worker process. */
    public static class ExitingAgent implements GuessingAgent {
        @Override public String agentId() { return "Exiting"; }

        @Override public void beginGame(GameConfig config) {}

        @Override
        public String guess(List<GuessRecord> history) {
            System.exit(3);
            return "zzzz";
        }
    }

    /** Answers with a word of the wrong length. */
    public static class OffLengthAgent implements GuessingAgent {
        @Override public String agentId() { return "OffLength"; }

        @Override public void beginGame(GameConfig config) {}

        @Override public String guess(List<GuessRecord> history) { return "x"; }
    }

    public static class ThrowingAgent implements GuessingAgent {
        @Override public String agentId() { return "Throwing"; }

        @Override public void beginGame(GameConfig config) {}

        @Override public String guess(List<GuessRecord> history) { throw new IllegalStateException("boom"); }
    }

    /** Sleeps before every answer; the answer itself is correct for a one-word vocabulary. */
    public static class SlowAgent implements GuessingAgent {
        public static final long DELAY_MS = 300;
        private String word;

        @Override public String agentId() { return "Slow"; }

        @Override public void beginGame(GameConfig config) { word = config.vocabulary().get(0); }

        @Override
        public String guess(List<GuessRecord> history) {
            try {
                Thread.sleep(DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return word;
        }
    }

    /** Never answers until interrupted. */
    public static class HangingAgent implements GuessingAgent {
        @Override public String agentId() { return "Hanging"; }

        @Override public void beginGame(GameConfig config) {}

        @Override
        public String guess(List<GuessRecord> history) {
            try {
                Thread.sleep(Long.MAX_VALUE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "zzzz";
        }
    }

    /** Has no public no-arg constructor; instantiation must fail. */
    public static class NoDefaultConstructorAgent implements GuessingAgent {
        public NoDefaultConstructorAgent(String ignored) {}

        @Override public String agentId() { return "NoCtor"; }

        @Override public void beginGame(GameConfig config) {}

        @Override public String guess(List<GuessRecord> history) { return "aaaa"; }
    }
}
