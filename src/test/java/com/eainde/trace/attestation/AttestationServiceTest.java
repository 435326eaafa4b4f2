package com.eainde.trace.attestation;

import com.eainde.trace.Fixtures;
import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.error.ExternalCapabilityException;
import com.eainde.trace.error.InputValidationException;
import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.AttestationRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AttestationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @TempDir
    Path directory;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final CapabilityInvoker invoker = new CapabilityInvoker(Runnable::run, Duration.ofSeconds(5));

    private FileHypothesisRegistry registry;
    private InMemoryLedgerWriter ledger;
    private AttestationService service;

    @BeforeEach
    void setUp() {
        registry = new FileHypothesisRegistry(directory, mapper);
        ledger = new InMemoryLedgerWriter(new ContentHasher(), clock);
        service = new AttestationService(new Canonicalizer(mapper), new ContentHasher(),
                registry, ledger, invoker, mapper, clock);
    }

    // =========================================================================
    // Happy path
    // =========================================================================

    @Nested
    @DisplayName("Attesting a valid card")
    class ValidCard {

        @Test
        @DisplayName("should hash the canonical form and record the metadata")
        void attests() {
            // GIVEN
            HypothesisRecord record = Fixtures.groundedHypothesis();

            // WHEN
            AttestationRecord attestation = service.attest(record, "alice");

            // THEN
            String canonical = new Canonicalizer(mapper).canonicalize(record);
            assertThat(attestation.hypothesisId()).isEqualTo("trace_hyp_0000abcd");
            assertThat(attestation.canonicalJson()).isEqualTo(canonical);
            assertThat(attestation.contentHash()).isEqualTo(new ContentHasher().hash(canonical));
            assertThat(attestation.createdAt()).isEqualTo(NOW);
            assertThat(attestation.version()).isEqualTo(AttestationService.VERSION);
            assertThat(attestation.author()).isEqualTo("alice");
            assertThat(ledger.receipt(attestation.ledgerTxId())).isPresent();
        }

        @Test
        @DisplayName("should store the enriched card with the ledger transaction id")
        void storesEnrichedCard() {
            AttestationRecord attestation = service.attest(Fixtures.groundedHypothesis(), "alice");

            ObjectNode stored = registry.find("trace_hyp_0000abcd").orElseThrow();
            assertThat(stored.get("content_hash").asText()).isEqualTo(attestation.contentHash());
            assertThat(stored.get("created_at").asText()).isEqualTo("2026-03-01T10:15:30Z");
            assertThat(stored.get("version").asText()).isEqualTo("v1");
            assertThat(stored.get("author").asText()).isEqualTo("alice");
            assertThat(stored.get("ledger_tx_id").asText()).isEqualTo(attestation.ledgerTxId());
        }

        @Test
        @DisplayName("should reproduce the hash when a stored card is attested again")
        void reattestStoredCard() {
            AttestationRecord first = service.attest(Fixtures.groundedHypothesis(), "alice");
            ObjectNode stored = registry.find("trace_hyp_0000abcd").orElseThrow();

            AttestationRecord second = service.attest(stored, "bob");

            assertThat(second.contentHash()).isEqualTo(first.contentHash());
            assertThat(second.ledgerTxId()).isNotEqualTo(first.ledgerTxId());
        }
    }

    // =========================================================================
    // Shape errors
    // =========================================================================

    @Nested
    @DisplayName("Rejecting malformed cards")
    class Malformed {

        @Test
        @DisplayName("should list every missing field, nested ones included")
        void missingFields() {
            // GIVEN
            ObjectNode card = mapper.valueToTree(Fixtures.groundedHypothesis());
            card.remove("rationale");
            ((ObjectNode) card.get("source_support")).remove("variables_used");

            // WHEN
            MissingFieldException thrown = catchThrowableOfType(
                    () -> service.attest(card, "alice"), MissingFieldException.class);

            // THEN
            assertThat(thrown.getMissingFields())
                    .containsExactly("rationale", "source_support.variables_used");
            assertThat(registry.list(HypothesisFilter.any())).isEmpty();
        }

        @Test
        @DisplayName("should reject a non-object nested field")
        void nestedNotObject() {
            ObjectNode card = mapper.valueToTree(Fixtures.groundedHypothesis());
            card.put("proposed_experiment", "run it");

            assertThatThrownBy(() -> service.attest(card, "alice"))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("proposed_experiment");
        }

        @Test
        @DisplayName("should reject a blank author")
        void blankAuthor() {
            assertThatThrownBy(() -> service.attest(Fixtures.groundedHypothesis(), " "))
                    .isInstanceOf(InputValidationException.class);
        }
    }

    @Test
    @DisplayName("should surface a failing ledger as an external capability error")
    void ledgerFailure() {
        // GIVEN
        LedgerWriter broken = (id, hash, author) -> {
            throw new IllegalStateException("ledger offline");
        };
        AttestationService failing = new AttestationService(new Canonicalizer(mapper), new ContentHasher(),
                registry, broken, invoker, mapper, clock);

        // WHEN / THEN
        assertThatThrownBy(() -> failing.attest(Fixtures.groundedHypothesis(), "alice"))
                .isInstanceOf(ExternalCapabilityException.class)
                .hasMessageContaining("ledger offline");
        assertThat(registry.find("trace_hyp_0000abcd")).get()
                .extracting(node -> node.has("ledger_tx_id"))
                .isEqualTo(false);
    }
}
