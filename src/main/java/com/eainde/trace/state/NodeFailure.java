package com.eainde.trace.state;

import com.eainde.trace.error.ErrorType;

import java.io.Serializable;
import java.util.Map;

/**
 * A node failure as recorded on the blackboard.
 *
 * @param phase   id of the node that failed
 * @param type    error category
 * @param message never empty
 */
public record NodeFailure(String phase, ErrorType type, String message) implements Serializable {

    public NodeFailure {
        message = message == null || message.isBlank() ? type + " in " + phase : message;
    }

    public static NodeFailure of(String phase, Throwable error) {
        return new NodeFailure(phase, ErrorType.of(error), error.getMessage());
    }

    /** Update that makes this the run's error. */
    public Map<String, Object> toErrorUpdate() {
        return Map.of(
                PipelineState.ERROR, message,
                PipelineState.ERROR_PHASE, phase,
                PipelineState.ERROR_TYPE, type.name());
    }
}
