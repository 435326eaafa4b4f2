package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing two documents: shared variables plus candidate synergies and conflicts.
 * Absent fields stay {@code null} so {@link #missingFields()} can report them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SynergyAnalysis(
        @JsonProperty("overlapping_variables") List<String> overlappingVariables,
        @JsonProperty("potential_synergies")   List<SynergyCandidate> potentialSynergies,
        @JsonProperty("potential_conflicts")   List<SynergyCandidate> potentialConflicts
) implements Serializable {

    public SynergyAnalysis {
        overlappingVariables = ModelLists.copyOrNull(overlappingVariables);
        potentialSynergies = ModelLists.copyOrNull(potentialSynergies);
        potentialConflicts = ModelLists.copyOrNull(potentialConflicts);
    }

    public static SynergyAnalysis empty() {
        return new SynergyAnalysis(List.of(), List.of(), List.of());
    }

    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (overlappingVariables == null) missing.add("overlapping_variables");
        if (potentialSynergies == null) missing.add("potential_synergies");
        if (potentialConflicts == null) missing.add("potential_conflicts");
        return missing;
    }

    public List<String> synergyIds() {
        return potentialSynergies == null
                ? List.of()
                : potentialSynergies.stream().map(SynergyCandidate::id).toList();
    }
}
