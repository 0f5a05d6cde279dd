package com.wordlearena.common.matching;

import com.wordlearena.common.model.Feedback;
import com.wordlearena.common.model.Mark;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Computes positional feedback for a guess against a secret.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Build a remaining-count table from the secret's letters.</li>
 *   <li>Pass 1: every exact positional match is CORRECT and consumes one count.</li>
 *   <li>Pass 2, left to right over the rest: PRESENT while the letter still has a
 *       remaining count (consuming it), otherwise ABSENT.</li>
 * </ol>
 *
 * <p>The two passes must run in this order: exact matches claim their letters
 * before any misplaced copy can, so Correct+Present for a letter never exceeds
 * its count in the secret, and repeated misplaced letters favour earlier positions.
 *
 * <p>Stateless and thread-safe.
 */
public final class FeedbackMatcher {

    private FeedbackMatcher() {}

    /**
     * @param guess  guessed word
     * @param secret secret word, same length as {@code guess}
     * @return feedback for {@code guess}
     * @throws IllegalArgumentException if the lengths differ
     */
    public static Feedback score(String guess, String secret) {
        if (guess.length() != secret.length()) {
            throw new IllegalArgumentException(String.format(
                "guess length (%d) != secret length (%d)", guess.length(), secret.length()));
        }
        String g = guess.toLowerCase(Locale.ROOT);
        String s = secret.toLowerCase(Locale.ROOT);
        int n = g.length();

        Mark[] marks = new Mark[n];
        Arrays.fill(marks, Mark.ABSENT);
        Map<Character, Integer> remaining = new HashMap<>();
        for (int i = 0; i < n; i++) {
            remaining.merge(s.charAt(i), 1, Integer::sum);
        }

        // Pass 1 – exact matches
        for (int i = 0; i < n; i++) {
            if (g.charAt(i) == s.charAt(i)) {
                marks[i] = Mark.CORRECT;
                remaining.merge(g.charAt(i), -1, Integer::sum);
            }
        }

        // Pass 2 – misplaced letters, greedy left to right
        for (int i = 0; i < n; i++) {
            if (marks[i] == Mark.CORRECT) continue;
            char c = g.charAt(i);
            int left = remaining.getOrDefault(c, 0);
            if (left > 0) {
                marks[i] = Mark.PRESENT;
                remaining.put(c, left - 1);
            }
        }

        return new Feedback(Arrays.asList(marks));
    }
}
