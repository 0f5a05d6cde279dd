package com.wordlearena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One History entry: a submitted guess and the feedback it received. */
public record GuessRecord(
    @JsonProperty("word")     String word,
    @JsonProperty("feedback") Feedback feedback
) {}
