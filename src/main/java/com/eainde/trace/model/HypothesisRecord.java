package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A falsifiable cross-document hypothesis ("hypothesis card").
 *
 * <p>Immutable. Validation and repair produce modified copies through the {@code with*} methods,
 * so a record handed to the canonicalizer can no longer change.</p>
 *
 * @param hypothesisId       opaque id, reassigned on every generation attempt
 * @param primarySynergyId   id of the synergy the hypothesis builds on
 * @param hypothesis         the hypothesis statement
 * @param rationale          justification referencing claim ids and variables
 * @param sourceSupport      claim ids and variables the hypothesis relies on
 * @param proposedExperiment how to test it
 * @param confidence         low / medium / high
 * @param riskNotes          known weaknesses; repair appends here
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"hypothesis_id", "primary_synergy_id", "hypothesis", "rationale",
        "source_support", "proposed_experiment", "confidence", "risk_notes"})
public record HypothesisRecord(
        @JsonProperty("hypothesis_id")       String hypothesisId,
        @JsonProperty("primary_synergy_id")  String primarySynergyId,
        @JsonProperty("hypothesis")          String hypothesis,
        @JsonProperty("rationale")           String rationale,
        @JsonProperty("source_support")      SourceSupport sourceSupport,
        @JsonProperty("proposed_experiment") ProposedExperiment proposedExperiment,
        @JsonProperty("confidence")          Confidence confidence,
        @JsonProperty("risk_notes")          List<String> riskNotes
) implements Serializable {

    public static final String UNKNOWN_SYNERGY = "unknown";

    public HypothesisRecord {
        primarySynergyId = primarySynergyId == null ? UNKNOWN_SYNERGY : primarySynergyId;
        hypothesis = hypothesis == null ? "" : hypothesis;
        rationale = rationale == null ? "" : rationale;
        sourceSupport = sourceSupport == null ? SourceSupport.empty() : sourceSupport;
        proposedExperiment = proposedExperiment == null ? ProposedExperiment.empty() : proposedExperiment;
        confidence = confidence == null ? Confidence.MEDIUM : confidence;
        riskNotes = ModelLists.copyOrEmpty(riskNotes);
    }

    public HypothesisRecord withHypothesisId(String id) {
        return new HypothesisRecord(id, primarySynergyId, hypothesis, rationale,
                sourceSupport, proposedExperiment, confidence, riskNotes);
    }

    public HypothesisRecord withPrimarySynergyId(String synergyId) {
        return new HypothesisRecord(hypothesisId, synergyId, hypothesis, rationale,
                sourceSupport, proposedExperiment, confidence, riskNotes);
    }

    public HypothesisRecord withSourceSupport(SourceSupport support) {
        return new HypothesisRecord(hypothesisId, primarySynergyId, hypothesis, rationale,
                support, proposedExperiment, confidence, riskNotes);
    }

    public HypothesisRecord withConfidence(Confidence newConfidence) {
        return new HypothesisRecord(hypothesisId, primarySynergyId, hypothesis, rationale,
                sourceSupport, proposedExperiment, newConfidence, riskNotes);
    }

    public HypothesisRecord withRiskNote(String note) {
        List<String> notes = new ArrayList<>(riskNotes);
        notes.add(note);
        return new HypothesisRecord(hypothesisId, primarySynergyId, hypothesis, rationale,
                sourceSupport, proposedExperiment, confidence, notes);
    }

    /** Low confidence with at least one risk note: a usable but caveated result. */
    @JsonIgnore
    public boolean isCaveated() {
        return confidence == Confidence.LOW && !riskNotes.isEmpty();
    }
}
