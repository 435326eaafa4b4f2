package com.eainde.trace.attestation;

/**
 * Records a tamper-evident receipt for an attested hypothesis.
 */
@FunctionalInterface
public interface LedgerWriter {

    /**
     * @return the ledger transaction id of the receipt
     */
    String writeReceipt(String hypothesisId, String contentHash, String author);
}
