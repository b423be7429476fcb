package com.vibetranslator.domain.vibe.exception;

/**
 * Network, auth, configuration or timeout failure of a generation or scoring call.
 */
public class ProviderUnavailableException extends VibePipelineException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
