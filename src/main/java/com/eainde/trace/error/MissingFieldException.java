package com.eainde.trace.error;

import java.util.List;

/**
 * Thrown when one or more required fields are absent. Every missing field is named, not just the first.
 */
public class MissingFieldException extends InputValidationException {

    private final List<String> missingFields;

    public MissingFieldException(List<String> missingFields) {
        super("Missing required fields: " + missingFields);
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
