package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeType {
    CLAIM("claim"),
    VARIABLE("variable");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
