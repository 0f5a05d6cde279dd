package com.wordlearena.lexicon;

import com.wordlearena.common.exception.ConfigurationException;

public class LexiconException extends ConfigurationException {

    public LexiconException(String message) {
        super(message);
    }

    public LexiconException(String message, Throwable cause) {
        super(message, cause);
    }
}
