package com.eainde.trace.error;

/**
 * An external capability (extraction, generation, ledger, document source) timed out or failed at
 * the transport level. Never retried inside the pipeline.
 */
public class ExternalCapabilityException extends PipelineException {

    private final String capability;

    public ExternalCapabilityException(String capability, String message, Throwable cause) {
        super("[" + capability + "] " + message, cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
