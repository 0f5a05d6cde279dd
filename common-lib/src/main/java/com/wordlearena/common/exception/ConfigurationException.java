package com.wordlearena.common.exception;

/**
 * Structural or setup failure (missing corpus, invalid settings, duplicate agent ids).
 * Surfaced to the operator; never produced by an agent.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
