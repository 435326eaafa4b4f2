package com.eainde.trace.error;

/**
 * Required input data (document fields, synergy analysis fields, hypothesis card shape) is missing
 * or malformed. Always fatal for the run.
 */
public class InputValidationException extends PipelineException {

    public InputValidationException(String message) {
        super(message);
    }
}
