package com.eainde.trace.attestation;

import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local ledger. Transaction ids are {@code 0x}-prefixed SHA-256 digests of the receipt
 * content and a sequence number, so writing the same receipt twice yields two transactions.
 */
@Log4j2
public class InMemoryLedgerWriter implements LedgerWriter {

    private final Map<String, LedgerReceipt> receipts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ContentHasher hasher;
    private final Clock clock;

    public InMemoryLedgerWriter(ContentHasher hasher, Clock clock) {
        this.hasher = hasher;
        this.clock = clock;
    }

    @Override
    public String writeReceipt(String hypothesisId, String contentHash, String author) {
        long seq = sequence.incrementAndGet();
        String txId = hasher.hash(String.join("|", hypothesisId, contentHash, author, Long.toString(seq)));
        receipts.put(txId, new LedgerReceipt(txId, hypothesisId, contentHash, author, seq, clock.instant()));
        log.info("Ledger receipt {} for {} ({})", txId, hypothesisId, contentHash);
        return txId;
    }

    public Optional<LedgerReceipt> receipt(String txId) {
        return Optional.ofNullable(receipts.get(txId));
    }

    public Collection<LedgerReceipt> receipts() {
        return List.copyOf(receipts.values());
    }
}
