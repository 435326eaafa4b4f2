package com.eainde.trace.attestation;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Off-ledger store of attested hypothesis cards, keyed by {@code hypothesis_id}.
 * Saving an id again replaces the stored card.
 */
public interface HypothesisRegistry {

    void save(ObjectNode card);

    Optional<ObjectNode> find(String hypothesisId);

    List<ObjectNode> list(HypothesisFilter filter);
}
