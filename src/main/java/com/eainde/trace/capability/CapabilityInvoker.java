package com.eainde.trace.capability;

import com.eainde.trace.error.ExternalCapabilityException;
import com.eainde.trace.error.PipelineException;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every external-capability call under the configured timeout.
 *
 * <p>A timeout, interruption or transport failure surfaces as {@link ExternalCapabilityException}.
 * Pipeline exceptions thrown by the call itself (format or validation errors) pass through
 * unchanged. There is no retry here. A timed-out call is abandoned, not force-cancelled;
 * cancelling the underlying request is the collaborator's job.</p>
 */
@Log4j2
public class CapabilityInvoker {

    private final Executor executor;
    private final Duration timeout;

    public CapabilityInvoker(Executor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public <T> T invoke(String capability, Callable<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[{}] call timed out after {}", capability, timeout);
            throw new ExternalCapabilityException(capability, "timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCapabilityException(capability, "interrupted while waiting for result", e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            log.error("[{}] call failed: {}", capability, cause.toString());
            throw new ExternalCapabilityException(capability, String.valueOf(cause.getMessage()), cause);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
