package com.eainde.trace.attestation;

import com.eainde.trace.model.Confidence;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Registry query. {@code null} components match everything.
 *
 * @param variablesUsed    matches cards sharing at least one variable
 * @param primarySynergyId exact match
 * @param confidence       exact match
 */
public record HypothesisFilter(Set<String> variablesUsed, String primarySynergyId, Confidence confidence) {

    public HypothesisFilter {
        variablesUsed = variablesUsed == null ? null : Set.copyOf(variablesUsed);
    }

    public static HypothesisFilter any() {
        return new HypothesisFilter(null, null, null);
    }

    public static HypothesisFilter byVariables(Set<String> variables) {
        return new HypothesisFilter(variables, null, null);
    }

    public static HypothesisFilter bySynergy(String synergyId) {
        return new HypothesisFilter(null, synergyId, null);
    }

    public static HypothesisFilter byConfidence(Confidence confidence) {
        return new HypothesisFilter(null, null, confidence);
    }

    public boolean matches(JsonNode card) {
        if (variablesUsed != null) {
            Set<String> cardVariables = new HashSet<>();
            card.path("source_support").path("variables_used").forEach(v -> cardVariables.add(v.asText()));
            cardVariables.retainAll(variablesUsed);
            if (cardVariables.isEmpty()) {
                return false;
            }
        }
        if (primarySynergyId != null && !primarySynergyId.equals(card.path("primary_synergy_id").asText(null))) {
            return false;
        }
        return confidence == null || confidence.label().equals(card.path("confidence").asText(null));
    }
}
