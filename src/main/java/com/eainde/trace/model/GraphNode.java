package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param id     deterministic id ({@code A_claim_1}, {@code B_var_2}, {@code var_temperature})
 * @param type   claim or variable
 * @param source originating document, {@code both} for overlap variables
 * @param text   claim text or variable name
 */
public record GraphNode(
        @JsonProperty("id")     String id,
        @JsonProperty("type")   NodeType type,
        @JsonProperty("paper")  DocumentOrigin source,
        @JsonProperty("text")   String text
) implements Serializable {

    @JsonIgnore
    public boolean isClaim() {
        return type == NodeType.CLAIM;
    }
}
