package com.eainde.trace;

import com.eainde.trace.model.Confidence;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.model.ProposedExperiment;
import com.eainde.trace.model.SourceSupport;
import com.eainde.trace.model.SynergyAnalysis;
import com.eainde.trace.model.SynergyCandidate;

import java.util.List;

/**
 * Shared test inputs: two small battery papers and a matching synergy analysis.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static DocumentRecord paperA() {
        return new DocumentRecord(
                List.of("c1", "c2"),
                List.of("thermal cycling"),
                List.of("e1"),
                List.of("small sample"),
                List.of(),
                List.of("temperature"));
    }

    public static DocumentRecord paperB() {
        return new DocumentRecord(
                List.of("c3"),
                List.of("impedance spectroscopy"),
                List.of("e2"),
                List.of("no thermal control"),
                List.of(),
                List.of("temperature", "voltage"));
    }

    public static SynergyCandidate synergy(String id, String description, List<String> a, List<String> b) {
        return new SynergyCandidate(id, description, a, b);
    }

    public static SynergyAnalysis analysis() {
        return new SynergyAnalysis(
                List.of("temperature"),
                List.of(synergy("syn_1", "Thermal cycling controls temperature drift", List.of("A_claim_1"), List.of("B_claim_1"))),
                List.of());
    }

    public static HypothesisRecord hypothesis(List<String> aClaims, List<String> bClaims, List<String> variables) {
        return new HypothesisRecord(
                "trace_hyp_0000abcd",
                "syn_1",
                "If thermal cycling is applied to cells under impedance monitoring, then temperature drift will decrease.",
                "A_claim_1 and B_claim_1 both involve temperature.",
                new SourceSupport(aClaims, bClaims, variables),
                new ProposedExperiment("Cycle cells at two temperatures", List.of("impedance"), "decrease"),
                Confidence.HIGH,
                List.of("Small sample size"));
    }

    public static HypothesisRecord groundedHypothesis() {
        return hypothesis(List.of("A_claim_1"), List.of("B_claim_1"), List.of("temperature"));
    }

    /** Generation output for {@link #groundedHypothesis()}. */
    public static String groundedCardJson() {
        return """
                {
                  "primary_synergy_id": "syn_1",
                  "hypothesis": "If thermal cycling is applied to cells under impedance monitoring, then temperature drift will decrease.",
                  "rationale": "A_claim_1 and B_claim_1 both involve temperature.",
                  "source_support": {
                    "paper_A_claim_ids": ["A_claim_1"],
                    "paper_B_claim_ids": ["B_claim_1"],
                    "variables_used": ["temperature"]
                  },
                  "proposed_experiment": {
                    "description": "Cycle cells at two temperatures",
                    "measurements": ["impedance"],
                    "expected_direction": "decrease"
                  },
                  "confidence": "high",
                  "risk_notes": ["Small sample size"]
                }
                """;
    }

    /** Generation output citing a claim that does not exist. */
    public static String ungroundedCardJson() {
        return groundedCardJson().replace("[\"A_claim_1\"]", "[\"A_claim_1\", \"A_claim_99\"]");
    }

    public static String analysisJson() {
        return """
                {
                  "_reasoning_trace": "thermal cycling addresses missing thermal control",
                  "overlapping_variables": ["temperature"],
                  "potential_synergies": [
                    {"id": "syn_1", "description": "Thermal cycling controls temperature drift",
                     "paper_A_support": ["A_claim_1"], "paper_B_support": ["B_claim_1"]}
                  ],
                  "potential_conflicts": []
                }
                """;
    }

    public static String extractionJson(DocumentRecord record) {
        return """
                {"claims": %s, "methods": %s, "evidence": %s,
                 "explicit_limitations": %s, "implicit_limitations": %s, "variables": %s}
                """.formatted(
                json(record.claims()), json(record.methods()), json(record.evidence()),
                json(record.explicitLimitations()), json(record.implicitLimitations()), json(record.variables()));
    }

    private static String json(List<String> values) {
        StringBuilder out = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append('"').append(values.get(i)).append('"');
        }
        return out.append(']').toString();
    }
}
