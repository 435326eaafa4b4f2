package com.eainde.trace.capability;

import com.eainde.trace.error.InputValidationException;
import com.eainde.trace.model.DocumentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Extraction implemented as one generation call plus structured-output parsing.
 *
 * <p>Output normalisation: absent fields become empty lists, evidence is capped at two items,
 * and non-text list items (e.g. variable descriptors given as objects) keep their JSON text.</p>
 */
@Log4j2
public class PromptedExtractionCapability implements ExtractionCapability {

    static final int MAX_EVIDENCE_ITEMS = 2;

    private static final String PROMPT_TEMPLATE = """
            You are extracting structured scientific information from a research paper.

            TITLE:
            %s

            PAPER TEXT:
            %s

            Extract the following fields in STRICT JSON format:

            - claims: list of the main scientific claims (all claims)
            - methods: the main methods or techniques used
            - evidence: concrete evidence supporting the claims (1-2 items, numerical or experimental details if stated)
            - explicit_limitations: limitations directly mentioned in the paper
            - implicit_limitations: limitations that follow logically from the research
            - variables: important variables or scientific factors mentioned (e.g., temperature, pressure, concentration, model parameters)

            Return ONLY valid JSON. Do not add commentary.
            """;

    private final GenerationCapability generation;
    private final StructuredOutputParser parser;

    public PromptedExtractionCapability(GenerationCapability generation, StructuredOutputParser parser) {
        this.generation = generation;
        this.parser = parser;
    }

    @Override
    public DocumentRecord extract(String text, String title) {
        if (text == null || text.isBlank()) {
            throw new InputValidationException("Paper text cannot be empty");
        }
        String prompt = PROMPT_TEMPLATE.formatted(title == null ? "" : title.strip(), text.strip());
        JsonNode root = parser.parseObject(generation.generate(prompt));

        if (root.hasNonNull("error")) {
            throw new InputValidationException("Extraction error: " + root.get("error").asText());
        }

        List<String> evidence = readList(root, "evidence");
        DocumentRecord record = new DocumentRecord(
                readList(root, "claims"),
                readList(root, "methods"),
                evidence.size() > MAX_EVIDENCE_ITEMS ? evidence.subList(0, MAX_EVIDENCE_ITEMS) : evidence,
                readList(root, "explicit_limitations"),
                readList(root, "implicit_limitations"),
                readList(root, "variables"));
        log.debug("Extracted '{}': {} claims, {} variables", title, record.claims().size(), record.variables().size());
        return record;
    }

    private static List<String> readList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isArray()) {
            values.add(node.isTextual() ? node.asText() : node.toString());
            return values;
        }
        for (JsonNode item : node) {
            if (item.isNull()) {
                continue;
            }
            values.add(item.isTextual() ? item.asText() : item.toString());
        }
        return values;
    }
}
