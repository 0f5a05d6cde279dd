package com.wordlearena.orchestrator.game;

import com.wordlearena.common.exception.ContractViolationException;
import com.wordlearena.common.model.GameConfig;

import java.util.Locale;

/**
 * Checks an agent's answer against the guess contract and returns the
 * normalized (lower-case) word.
 */
public final class GuessValidator {

    private GuessValidator() {}

    public static String validate(String agentId, String guess, GameConfig config) {
        if (guess == null) {
            throw new ContractViolationException(agentId, null, "returned null instead of a guess");
        }
        String word = guess.toLowerCase(Locale.ROOT);
        if (word.length() != config.wordLength()) {
            throw new ContractViolationException(agentId, guess,
                "guess '" + guess + "' has length " + word.length() + ", expected " + config.wordLength());
        }
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'a' || c > 'z') {
                throw new ContractViolationException(agentId, guess,
                    "guess '" + guess + "' contains a character outside a-z");
            }
        }
        if (!config.allowNonWords() && !config.inVocabulary(word)) {
            throw new ContractViolationException(agentId, guess,
                "guess '" + guess + "' is not in the vocabulary");
        }
        return word;
    }
}
