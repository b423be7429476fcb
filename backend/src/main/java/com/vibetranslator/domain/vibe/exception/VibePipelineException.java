package com.vibetranslator.domain.vibe.exception;

/**
 * Root of the failures raised inside the generation and ranking pipeline.
 * None of them reach the caller of the pipeline: every one is absorbed by a fallback tier.
 */
public class VibePipelineException extends RuntimeException {

    public VibePipelineException(String message) {
        super(message);
    }

    public VibePipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
