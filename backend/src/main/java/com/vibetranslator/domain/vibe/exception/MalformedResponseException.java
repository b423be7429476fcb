package com.vibetranslator.domain.vibe.exception;

/**
 * Provider text that could not be parsed as JSON.
 */
public class MalformedResponseException extends VibePipelineException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
