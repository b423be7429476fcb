package com.vibetranslator.infrastructure.ai.pipeline;

/**
 * Record of a single tier attempt for observability.
 *
 * @param tierName       name of the tier
 * @param tierIndex      0-based position in the chain
 * @param outcome        result of the attempt
 * @param durationMillis time taken in milliseconds
 * @param errorDetails   failure description, null on success
 */
public record AttemptRecord(
        String tierName,
        int tierIndex,
        AttemptOutcome outcome,
        long durationMillis,
        String errorDetails
) {
    public AttemptRecord {
        if (tierIndex < 0) {
            throw new IllegalArgumentException("tierIndex must be >= 0");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must be >= 0");
        }
    }
}
