package com.vibetranslator.infrastructure.ai.pipeline;

/**
 * Outcome of a single tier attempt (generation or scoring).
 */
public enum AttemptOutcome {
    /**
     * Output was parsed and satisfied the structural contract.
     */
    SUCCESS,

    /**
     * Network, auth, configuration or timeout failure; no usable text came back.
     */
    PROVIDER_UNAVAILABLE,

    /**
     * Text came back but could not be parsed as JSON.
     */
    MALFORMED_RESPONSE,

    /**
     * JSON parsed but had the wrong shape, length or labels.
     */
    CONTRACT_VIOLATION
}
