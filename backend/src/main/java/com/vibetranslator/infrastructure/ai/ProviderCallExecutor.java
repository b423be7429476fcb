package com.vibetranslator.infrastructure.ai;

import com.vibetranslator.domain.vibe.exception.ProviderUnavailableException;
import com.vibetranslator.domain.vibe.exception.VibePipelineException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one external call with a deadline.
 * Timeouts and interruption cancel the in-flight call and surface as {@link ProviderUnavailableException},
 * so a timed-out tier is handled exactly like a failed one.
 */
public class ProviderCallExecutor {

    private final ExecutorService executor;
    private final Duration timeout;

    public ProviderCallExecutor(ExecutorService executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T call(String callName, Callable<T> callable) {
        Future<T> future = executor.submit(callable);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderUnavailableException(callName + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(callName + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VibePipelineException pipelineException) {
                throw pipelineException;
            }
            throw new ProviderUnavailableException(callName + " failed: " + cause.getMessage(), cause);
        }
    }
}
