package com.eainde.trace.hypothesis;

import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.capability.GenerationCapability;
import com.eainde.trace.capability.StructuredOutputParser;
import com.eainde.trace.error.GenerationFormatException;
import com.eainde.trace.model.HypothesisRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * One generation attempt: builds the prompt, calls the generation capability under the
 * configured timeout, and normalises the reply into a {@link HypothesisRecord}.
 *
 * <p>Normalisation defaults: missing confidence is medium, missing risk notes are empty,
 * missing primary synergy is {@code unknown}, and a non-object {@code source_support} or
 * {@code proposed_experiment} is replaced by an empty one.</p>
 */
@Log4j2
public class HypothesisGenerator {

    static final String CAPABILITY = "hypothesis-generation";

    private final GenerationCapability generation;
    private final CapabilityInvoker invoker;
    private final StructuredOutputParser parser;
    private final HypothesisPrompts prompts = new HypothesisPrompts();
    private final ObjectMapper cardMapper = JsonMapper.builder()
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .build();

    public HypothesisGenerator(GenerationCapability generation, CapabilityInvoker invoker, StructuredOutputParser parser) {
        this.generation = generation;
        this.invoker = invoker;
        this.parser = parser;
    }

    /**
     * @param attempt        0 for the first call
     * @param previousErrors validation errors of the previous attempt, empty on attempt 0
     */
    public HypothesisRecord generate(HypothesisContext context, int attempt, List<String> previousErrors) {
        String prompt = attempt == 0 ? prompts.baseline(context) : prompts.retry(context, previousErrors);
        log.debug("Generation attempt {} ({} prompt chars)", attempt, prompt.length());

        String raw = invoker.invoke(CAPABILITY, () -> generation.generate(prompt));
        ObjectNode card = (ObjectNode) parser.parseObject(raw);
        dropIfNotObject(card, "source_support");
        dropIfNotObject(card, "proposed_experiment");
        try {
            return cardMapper.treeToValue(card, HypothesisRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GenerationFormatException("Generation output is not a hypothesis card", e);
        }
    }

    private static void dropIfNotObject(ObjectNode card, String field) {
        JsonNode value = card.get(field);
        if (value != null && !value.isObject()) {
            log.warn("Ignoring non-object {} in generation output", field);
            card.remove(field);
        }
    }
}
