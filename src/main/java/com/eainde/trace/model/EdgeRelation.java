package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeRelation {
    USES_VARIABLE("uses_variable"),
    POTENTIAL_SYNERGY("potential_synergy"),
    POTENTIAL_CONFLICT("potential_conflict");

    private final String label;

    EdgeRelation(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
