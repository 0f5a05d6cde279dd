package com.wordlearena.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wordlearena.common.exception.ConfigurationException;
import com.wordlearena.common.model.DistributionMode;

import java.util.List;

/** A problem configuration: word length plus distribution mode. */
public record RoundSpec(
    @JsonProperty("wordLength") int wordLength,
    @JsonProperty("mode")       DistributionMode mode
) {
    public static final List<RoundSpec> CANONICAL = List.of(
        new RoundSpec(4, DistributionMode.UNIFORM),
        new RoundSpec(4, DistributionMode.FREQUENCY),
        new RoundSpec(5, DistributionMode.UNIFORM),
        new RoundSpec(5, DistributionMode.FREQUENCY),
        new RoundSpec(6, DistributionMode.UNIFORM),
        new RoundSpec(6, DistributionMode.FREQUENCY)
    );

    /** {@code "5_frequency"}. */
    public String id() {
        return wordLength + "_" + mode.label();
    }

    /** Parses the {@link #id()} form, e.g. {@code "4_uniform"}. */
    public static RoundSpec parse(String id) {
        String[] parts = id.trim().split("_", 2);
        if (parts.length != 2) {
            throw new ConfigurationException("Round must look like '<length>_<mode>', got '" + id + "'");
        }
        try {
            return new RoundSpec(Integer.parseInt(parts[0]), DistributionMode.fromLabel(parts[1]));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid round '" + id + "'", e);
        }
    }
}
