package com.vibetranslator.domain.vibe.exception;

/**
 * Parsed generation output with the wrong shape, length or vibe labels.
 */
public class ContractViolationException extends VibePipelineException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
