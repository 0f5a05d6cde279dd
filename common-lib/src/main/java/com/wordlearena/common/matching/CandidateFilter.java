package com.wordlearena.common.matching;

import com.wordlearena.common.model.Feedback;
import com.wordlearena.common.model.GuessRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a candidate set to the words consistent with observed feedback.
 * Delegates every comparison to {@link FeedbackMatcher}; there is no second
 * implementation of the matching rules here.
 *
 * <p>An empty result is a legal state, not an error.
 */
public final class CandidateFilter {

    private CandidateFilter() {}

    /**
     * Keeps every {@code w} in {@code candidates} with {@code score(guess, w).equals(feedback)},
     * preserving input order.
     */
    public static List<String> filter(List<String> candidates, String guess, Feedback feedback) {
        List<String> kept = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate.length() == guess.length()
                    && FeedbackMatcher.score(guess, candidate).equals(feedback)) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    /** Applies every recorded (guess, feedback) pair in order. */
    public static List<String> filter(List<String> candidates, List<GuessRecord> history) {
        List<String> current = new ArrayList<>(candidates);
        for (GuessRecord record : history) {
            current = filter(current, record.word(), record.feedback());
        }
        return current;
    }
}
