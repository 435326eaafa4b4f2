package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Lenient parse of model output. Missing or unrecognised values fall back to {@link #MEDIUM}.
     */
    @JsonCreator
    public static Confidence fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Confidence confidence : values()) {
            if (confidence.label.equals(normalized)) {
                return confidence;
            }
        }
        return MEDIUM;
    }
}
