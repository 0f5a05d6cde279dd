package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable positional feedback for one guess. Only
 * {@link com.wordlearena.common.matching.FeedbackMatcher} produces these during a game;
 * {@link #fromCode(String)} exists for fixtures and deserialization.
 *
 * <p>Serialized as its digit code, e.g. {@code "21000"}.
 */
public record Feedback(List<Mark> marks) {

    public Feedback {
        marks = List.copyOf(marks);
    }

    public int length() {
        return marks.size();
    }

    public Mark markAt(int position) {
        return marks.get(position);
    }

    public boolean isSolved() {
        return !marks.isEmpty() && marks.stream().allMatch(m -> m == Mark.CORRECT);
    }

    /** Base-3 integer form, position 0 least significant. Handy as a partition key. */
    public int encode() {
        int value = 0;
        int weight = 1;
        for (Mark mark : marks) {
            value += mark.code() * weight;
            weight *= 3;
        }
        return value;
    }

    @JsonValue
    public String code() {
        StringBuilder sb = new StringBuilder(marks.size());
        for (Mark mark : marks) {
            sb.append(mark.code());
        }
        return sb.toString();
    }

    @JsonCreator
    public static Feedback fromCode(String code) {
        List<Mark> parsed = new ArrayList<>(code.length());
        for (int i = 0; i < code.length(); i++) {
            parsed.add(Mark.fromCode(Character.digit(code.charAt(i), 10)));
        }
        return new Feedback(parsed);
    }

    @Override
    public String toString() {
        return code();
    }
}
