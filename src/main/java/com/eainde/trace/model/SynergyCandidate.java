package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A proposed cross-document relationship produced by synergy analysis. Conflicts share this shape.
 *
 * @param id              opaque id such as {@code syn_1} or {@code conf_1}
 * @param description     free-text description of the relationship
 * @param paperASupport   supporting claim ids from document A
 * @param paperBSupport   supporting claim ids from document B
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SynergyCandidate(
        @JsonProperty("id")              String id,
        @JsonProperty("description")     String description,
        @JsonProperty("paper_A_support") List<String> paperASupport,
        @JsonProperty("paper_B_support") List<String> paperBSupport
) implements Serializable {

    public SynergyCandidate {
        id = id == null ? "" : id;
        description = description == null ? "" : description;
        paperASupport = ModelLists.copyOrEmpty(paperASupport);
        paperBSupport = ModelLists.copyOrEmpty(paperBSupport);
    }

    public int supportSize() {
        return paperASupport.size() + paperBSupport.size();
    }
}
