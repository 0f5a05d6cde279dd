package com.wordlearena.common.model;

/**
 * Per-position feedback mark. The numeric code is the 2/1/0 encoding used in
 * reports and in {@link Feedback#code()}.
 */
public enum Mark {
    ABSENT(0),
    PRESENT(1),
    CORRECT(2);

    private final int code;

    Mark(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Mark fromCode(int code) {
        return switch (code) {
            case 0 -> ABSENT;
            case 1 -> PRESENT;
            case 2 -> CORRECT;
            default -> throw new IllegalArgumentException("Unknown mark code: " + code);
        };
    }
}
