package com.wordlearena.common.exception;

/** An agent returned a malformed or disallowed word. Faults the episode. */
public class ContractViolationException extends AgentException {

    private final String offendingWord;

    public ContractViolationException(String agentId, String offendingWord, String message) {
        super(agentId, Phase.GUESS, message);
        this.offendingWord = offendingWord;
    }

    public String getOffendingWord() {
        return offendingWord;
    }
}
