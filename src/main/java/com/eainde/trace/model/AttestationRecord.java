package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Content hash plus author and timestamp metadata for one hypothesis.
 * {@code ledgerTxId} is {@code null} until the ledger collaborator has recorded the receipt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttestationRecord(
        @JsonProperty("hypothesis_id")  String hypothesisId,
        @JsonProperty("canonical_json") String canonicalJson,
        @JsonProperty("content_hash")   String contentHash,
        @JsonProperty("created_at")     Instant createdAt,
        @JsonProperty("version")        String version,
        @JsonProperty("author")         String author,
        @JsonProperty("ledger_tx_id")   String ledgerTxId
) implements Serializable {

    public AttestationRecord withLedgerTxId(String txId) {
        return new AttestationRecord(hypothesisId, canonicalJson, contentHash, createdAt, version, author, txId);
    }
}
