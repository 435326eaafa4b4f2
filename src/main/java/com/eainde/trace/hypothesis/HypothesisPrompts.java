package com.eainde.trace.hypothesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Prompt text for hypothesis generation. Attempt 0 uses the baseline prompt; later attempts
 * prepend the previous validation errors and the complete lists of ids the model may use,
 * since each call starts without memory of the last one.
 */
final class HypothesisPrompts {

    private static final String CARD_FORMAT = """
            Return a JSON object with this EXACT structure:
            {
              "primary_synergy_id": "syn_1",
              "hypothesis": "If [method from Paper A] is applied to [system from Paper B], then [variable] will [increase/decrease/change] due to [mechanism].",
              "rationale": "Technical justification that cites claim ids such as A_claim_1 and B_claim_2 and the variables involved.",
              "source_support": {
                "paper_A_claim_ids": ["A_claim_1"],
                "paper_B_claim_ids": ["B_claim_1"],
                "variables_used": ["variable_from_paper_a", "variable_from_paper_b"]
              },
              "proposed_experiment": {
                "description": "Concrete experimental setup that could test this hypothesis.",
                "measurements": ["specific_metric_1", "specific_metric_2"],
                "expected_direction": "increase / decrease / non-linear effect"
              },
              "confidence": "low / medium / high",
              "risk_notes": ["Key assumption that might fail"]
            }

            Return ONLY the JSON object. Do not add commentary.
            """;

    private static final String BASELINE = """
            You are a scientific hypothesis generation agent. Propose ONE new, falsifiable hypothesis that
            combines elements from BOTH papers. Do not summarise the papers and do not introduce outside
            knowledge, datasets, variables or numbers that the inputs do not imply.

            PAPER A:
            %s

            PAPER B:
            %s

            SYNERGY ANALYSIS:
            %s
            %s
            RULES:
            1. Use actual values from the `methods`, `explicit_limitations`, `variables` and `claims` fields.
            2. Only use variables present in the `variables` fields of the two papers.
            3. Claim ids are 1-based positions in each paper's `claims` list (A_claim_1, B_claim_1, ...).
            4. The hypothesis must be testable with specific measurements.

            %s""";

    private static final String RETRY = """
            RETRY REQUEST: the previous hypothesis referenced ids that do not exist.

            VALIDATION ERRORS FROM PREVIOUS ATTEMPT:
            %s

            You MUST use ONLY the following values.

            VALID PAPER A CLAIM IDs:
            %s

            VALID PAPER B CLAIM IDs:
            %s

            VALID VARIABLES:
            %s

            VALID SYNERGY IDs (primary_synergy_id MUST be one of these):
            %s

            """;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    String baseline(HypothesisContext context) {
        String primary = context.primary()
                .map(synergy -> "\nPRIMARY SYNERGY TO FOCUS ON:\n" + json(synergy) + "\n")
                .orElse("");
        return BASELINE.formatted(
                json(context.paperA()),
                json(context.paperB()),
                json(context.synergyAnalysis()),
                primary,
                CARD_FORMAT);
    }

    String retry(HypothesisContext context, List<String> previousErrors) {
        GroundingReference reference = context.reference();
        StringBuilder feedback = new StringBuilder();
        for (String error : previousErrors) {
            if (feedback.length() > 0) {
                feedback.append('\n');
            }
            feedback.append("  - ").append(error);
        }
        return RETRY.formatted(
                feedback,
                json(new ArrayList<>(reference.paperAClaimIds())),
                json(new ArrayList<>(reference.paperBClaimIds())),
                json(new ArrayList<>(reference.variables())),
                json(reference.sortedSynergyIds()))
                + baseline(context);
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
