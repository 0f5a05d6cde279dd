package com.wordlearena.common.model;

import java.util.Locale;

/**
 * How the probability mass over a vocabulary is derived.
 * UNIFORM gives every word 1/N; FREQUENCY weights words by corpus counts.
 */
public enum DistributionMode {
    UNIFORM,
    FREQUENCY;

    /** Lower-case label used in round ids and corpus lookups ("uniform", "frequency"). */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DistributionMode fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
