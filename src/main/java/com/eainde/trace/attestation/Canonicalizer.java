package com.eainde.trace.attestation;

import com.eainde.trace.error.InputValidationException;
import com.eainde.trace.model.HypothesisRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic serialization of a hypothesis card.
 *
 * <p>Only {@link #CORE_FIELDS} take part, so metadata added later (hash, timestamps, ledger ids)
 * never changes the result. Object keys are sorted by UTF-8 byte order at every depth, arrays
 * keep their order, output is compact and non-ASCII characters are written as-is.</p>
 */
public class Canonicalizer {

    public static final List<String> CORE_FIELDS = List.of(
            "hypothesis_id",
            "primary_synergy_id",
            "hypothesis",
            "rationale",
            "source_support",
            "proposed_experiment",
            "confidence",
            "risk_notes");

    private final ObjectMapper mapper;

    public Canonicalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String canonicalize(HypothesisRecord record) {
        return canonicalize(mapper.valueToTree(record));
    }

    public String canonicalize(JsonNode card) {
        if (card == null || !card.isObject()) {
            throw new InputValidationException("Hypothesis card must be a JSON object");
        }
        ObjectNode projected = JsonNodeFactory.instance.objectNode();
        for (String field : CORE_FIELDS) {
            if (card.has(field)) {
                projected.set(field, card.get(field));
            }
        }
        try {
            return mapper.writeValueAsString(sorted(projected));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            names.sort((left, right) -> Arrays.compareUnsigned(
                    left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8)));

            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                copy.set(name, sorted(node.get(name)));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            for (JsonNode item : node) {
                copy.add(sorted(item));
            }
            return copy;
        }
        return node;
    }
}
