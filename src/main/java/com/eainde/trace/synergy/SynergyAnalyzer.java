package com.eainde.trace.synergy;

import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.capability.GenerationCapability;
import com.eainde.trace.capability.StructuredOutputParser;
import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.SynergyAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.log4j.Log4j2;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Asks the generation capability where a method of one document addresses an explicit
 * limitation of the other ("capability-to-need" fit).
 *
 * <p>The reply must carry all three fields of {@link SynergyAnalysis}; lists may be empty.</p>
 */
@Log4j2
public class SynergyAnalyzer {

    static final String CAPABILITY = "synergy-analysis";

    private static final String INSTRUCTIONS = """
            You are a scientific analysis agent that compares two structured paper representations.

            RULES:
            1. You receive ALREADY STRUCTURED JSON, not raw paper text.
            2. Do not invent claims or variables that are not present in the input JSON.
            3. Only identify synergies or conflicts that are scientifically plausible given the claims, evidence and variables.
            4. Return STRICT JSON only.

            Analyze these two papers for a "Capability-to-Need" technical fit.

            PAPER A:
            %s

            PAPER B:
            %s

            Find where a specific method (from the `methods` field) in one paper addresses a specific
            limitation (from the `explicit_limitations` field) in the other.

            Output a STRICT JSON object:
            {
              "potential_synergies": [
                {
                  "id": "syn_1",
                  "description": "The [method from Paper A] addresses the [limitation in Paper B] by [mechanism].",
                  "paper_A_support": ["A_claim_1"],
                  "paper_B_support": ["B_claim_1"]
                }
              ],
              "overlapping_variables": ["variable1"],
              "potential_conflicts": [
                {
                  "id": "conf_1",
                  "description": "Specific description of the conflict or tension",
                  "paper_A_support": ["A_claim_2"],
                  "paper_B_support": ["B_claim_1"]
                }
              ]
            }

            Claim ids are 1-based positions in each paper's `claims` list (A_claim_1, B_claim_1, ...).
            A synergy must cite claim ids from BOTH papers. If there is no strong fit, return empty lists.
            Return ONLY valid JSON.
            """;

    private final GenerationCapability generation;
    private final CapabilityInvoker invoker;
    private final StructuredOutputParser parser;
    private final ObjectMapper promptMapper;

    public SynergyAnalyzer(GenerationCapability generation, CapabilityInvoker invoker, StructuredOutputParser parser) {
        this.generation = generation;
        this.invoker = invoker;
        this.parser = parser;
        this.promptMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public SynergyAnalysis analyze(DocumentRecord a, DocumentRecord b) {
        String prompt = INSTRUCTIONS.formatted(toJson(a), toJson(b));
        String raw = invoker.invoke(CAPABILITY, () -> generation.generate(prompt));
        SynergyAnalysis analysis = parser.parse(raw, SynergyAnalysis.class);

        List<String> missing = analysis.missingFields();
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing.stream().map(f -> "synergy_analysis." + f).toList());
        }
        log.info("Synergy analysis: {} overlapping variables, {} synergies, {} conflicts",
                analysis.overlappingVariables().size(),
                analysis.potentialSynergies().size(),
                analysis.potentialConflicts().size());
        return analysis;
    }

    private String toJson(DocumentRecord record) {
        try {
            return promptMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
