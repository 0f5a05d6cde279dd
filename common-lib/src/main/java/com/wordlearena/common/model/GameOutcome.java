package com.wordlearena.common.model;

/** Terminal state of one episode. Only SOLVED keeps the true guess count for scoring. */
public enum GameOutcome {
    SOLVED,
    EXHAUSTED,
    FAULTED,
    TIMED_OUT;

    public boolean isSolved() {
        return this == SOLVED;
    }
}
