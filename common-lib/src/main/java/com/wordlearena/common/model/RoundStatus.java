package com.wordlearena.common.model;

/**
 * COMPLETE rounds are scored. INCOMPLETE rounds were cut short by a stop signal;
 * FAILED rounds never ran because setup raised a configuration error.
 */
public enum RoundStatus {
    COMPLETE,
    INCOMPLETE,
    FAILED
}
