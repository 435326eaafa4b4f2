package com.eainde.trace.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a grounding check.
 *
 * @param valid   no violations found
 * @param errors  one description per violated category, naming the offending values
 * @param fixable every violation can be removed mechanically by repair
 */
public record ValidationResult(boolean valid, List<String> errors, boolean fixable) implements Serializable {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), true);
    }

    public static ValidationResult invalid(List<String> errors, boolean fixable) {
        return new ValidationResult(false, errors, fixable);
    }
}
