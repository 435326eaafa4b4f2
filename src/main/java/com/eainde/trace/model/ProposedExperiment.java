package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProposedExperiment(
        @JsonProperty("description")        String description,
        @JsonProperty("measurements")       List<String> measurements,
        @JsonProperty("expected_direction") String expectedDirection
) implements Serializable {

    public ProposedExperiment {
        description = description == null ? "" : description;
        measurements = ModelLists.copyOrEmpty(measurements);
        expectedDirection = expectedDirection == null ? "" : expectedDirection;
    }

    public static ProposedExperiment empty() {
        return new ProposedExperiment("", List.of(), "");
    }
}
