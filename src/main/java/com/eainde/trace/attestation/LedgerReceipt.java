package com.eainde.trace.attestation;

import java.io.Serializable;
import java.time.Instant;

public record LedgerReceipt(
        String txId,
        String hypothesisId,
        String contentHash,
        String author,
        long sequence,
        Instant recordedAt
) implements Serializable {
}
