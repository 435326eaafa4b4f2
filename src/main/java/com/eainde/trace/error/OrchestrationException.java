package com.eainde.trace.error;

/**
 * Generic node failure propagated by the orchestrator. Always carries the owning phase name.
 */
public class OrchestrationException extends PipelineException {

    public OrchestrationException(String phase, String message) {
        super(message, phase, null);
    }

    public OrchestrationException(String phase, String message, Throwable cause) {
        super(message, phase, cause);
    }
}
