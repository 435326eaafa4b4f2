package com.eainde.trace.error;

/**
 * Category reported in a failed pipeline result.
 */
public enum ErrorType {
    INPUT_VALIDATION,
    GENERATION_FORMAT,
    EXTERNAL_CAPABILITY,
    ORCHESTRATION;

    public static ErrorType of(Throwable error) {
        if (error instanceof InputValidationException) {
            return INPUT_VALIDATION;
        }
        if (error instanceof GenerationFormatException) {
            return GENERATION_FORMAT;
        }
        if (error instanceof ExternalCapabilityException) {
            return EXTERNAL_CAPABILITY;
        }
        return ORCHESTRATION;
    }
}
