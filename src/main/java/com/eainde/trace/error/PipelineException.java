package com.eainde.trace.error;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 * <p>
 * The optional {@code phase} names the pipeline node that owned the failure, so the
 * orchestrator can report where a run stopped without inspecting the stack trace.
 * </p>
 */
public class PipelineException extends RuntimeException {

    private final String phase;

    public PipelineException(String message) {
        this(message, null, null);
    }

    public PipelineException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PipelineException(String message, String phase, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
