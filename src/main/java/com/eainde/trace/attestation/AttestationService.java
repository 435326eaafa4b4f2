package com.eainde.trace.attestation;

import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.error.InputValidationException;
import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.AttestationRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Commits a hypothesis card: canonicalize, hash, store the enriched card, record a ledger
 * receipt, then store the card again with the receipt's transaction id.
 */
@Log4j2
public class AttestationService {

    public static final String VERSION = "v1";

    private static final String LEDGER = "ledger";
    private static final List<String> SOURCE_SUPPORT_FIELDS =
            List.of("paper_A_claim_ids", "paper_B_claim_ids", "variables_used");
    private static final List<String> EXPERIMENT_FIELDS =
            List.of("description", "measurements", "expected_direction");

    private final Canonicalizer canonicalizer;
    private final ContentHasher hasher;
    private final HypothesisRegistry registry;
    private final LedgerWriter ledger;
    private final CapabilityInvoker invoker;
    private final ObjectMapper mapper;
    private final Clock clock;

    public AttestationService(Canonicalizer canonicalizer,
                              ContentHasher hasher,
                              HypothesisRegistry registry,
                              LedgerWriter ledger,
                              CapabilityInvoker invoker,
                              ObjectMapper mapper,
                              Clock clock) {
        this.canonicalizer = canonicalizer;
        this.hasher = hasher;
        this.registry = registry;
        this.ledger = ledger;
        this.invoker = invoker;
        this.mapper = mapper;
        this.clock = clock;
    }

    public AttestationRecord attest(HypothesisRecord hypothesis, String author) {
        return attest((ObjectNode) mapper.valueToTree(hypothesis), author);
    }

    /**
     * Accepts cards that already carry extra metadata; only the core fields are hashed.
     */
    public AttestationRecord attest(ObjectNode card, String author) {
        validateShape(card);
        if (author == null || author.isBlank()) {
            throw new InputValidationException("Author must not be blank");
        }
        String hypothesisId = card.get("hypothesis_id").asText();
        String canonical = canonicalizer.canonicalize(card);
        String contentHash = hasher.hash(canonical);
        Instant createdAt = clock.instant();

        ObjectNode enriched = card.deepCopy();
        enriched.put("content_hash", contentHash);
        enriched.put("created_at", createdAt.toString());
        enriched.put("version", VERSION);
        enriched.put("author", author);
        registry.save(enriched);

        String txId = invoker.invoke(LEDGER, () -> ledger.writeReceipt(hypothesisId, contentHash, author));
        enriched.put("ledger_tx_id", txId);
        registry.save(enriched);

        log.info("Attested {} as {} (tx {})", hypothesisId, contentHash, txId);
        return new AttestationRecord(hypothesisId, canonical, contentHash, createdAt, VERSION, author, txId);
    }

    /**
     * Required top-level and nested fields must be present; every missing one is reported.
     */
    static void validateShape(JsonNode card) {
        if (card == null || !card.isObject()) {
            throw new InputValidationException("Hypothesis card must be a JSON object");
        }
        List<String> missing = new ArrayList<>();
        for (String field : Canonicalizer.CORE_FIELDS) {
            if (!card.has(field)) {
                missing.add(field);
            }
        }
        checkNested(card, "source_support", SOURCE_SUPPORT_FIELDS, missing);
        checkNested(card, "proposed_experiment", EXPERIMENT_FIELDS, missing);
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing);
        }
        if (card.path("hypothesis_id").asText("").isBlank()) {
            throw new InputValidationException("Hypothesis card must have hypothesis_id");
        }
    }

    private static void checkNested(JsonNode card, String field, List<String> required, List<String> missing) {
        JsonNode nested = card.get(field);
        if (nested == null) {
            return;
        }
        if (!nested.isObject()) {
            throw new InputValidationException(field + " must be a JSON object");
        }
        for (String name : required) {
            if (!nested.has(name)) {
                missing.add(field + "." + name);
            }
        }
    }
}
