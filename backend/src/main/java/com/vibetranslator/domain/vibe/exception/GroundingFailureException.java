package com.vibetranslator.domain.vibe.exception;

/**
 * Grounding store failure. Always swallowed, grounding is additive.
 */
public class GroundingFailureException extends VibePipelineException {

    public GroundingFailureException(String message) {
        super(message);
    }

    public GroundingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
