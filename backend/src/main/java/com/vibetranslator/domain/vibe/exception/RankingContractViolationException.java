package com.vibetranslator.domain.vibe.exception;

/**
 * Scoring output that does not cover every submitted candidate exactly once.
 */
public class RankingContractViolationException extends VibePipelineException {

    public RankingContractViolationException(String message) {
        super(message);
    }

    public RankingContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
