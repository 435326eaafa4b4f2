package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which input document a graph node came from.
 */
public enum DocumentOrigin {
    A("A"),
    B("B"),
    BOTH("both");

    private final String label;

    DocumentOrigin(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Prefix used in node ids, e.g. {@code A_claim_1}. Only defined for single-document origins. */
    public String idPrefix() {
        if (this == BOTH) {
            throw new IllegalStateException("Overlap nodes have no document prefix");
        }
        return label;
    }

    @JsonCreator
    public static DocumentOrigin fromLabel(String label) {
        for (DocumentOrigin origin : values()) {
            if (origin.label.equalsIgnoreCase(label)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown document origin: " + label);
    }
}
