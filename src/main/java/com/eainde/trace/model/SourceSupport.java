package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceSupport(
        @JsonProperty("paper_A_claim_ids") List<String> paperAClaimIds,
        @JsonProperty("paper_B_claim_ids") List<String> paperBClaimIds,
        @JsonProperty("variables_used")    List<String> variablesUsed
) implements Serializable {

    public SourceSupport {
        paperAClaimIds = ModelLists.copyOrEmpty(paperAClaimIds);
        paperBClaimIds = ModelLists.copyOrEmpty(paperBClaimIds);
        variablesUsed = ModelLists.copyOrEmpty(variablesUsed);
    }

    public static SourceSupport empty() {
        return new SourceSupport(List.of(), List.of(), List.of());
    }
}
