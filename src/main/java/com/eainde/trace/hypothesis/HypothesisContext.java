package com.eainde.trace.hypothesis;

import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.SynergyAnalysis;
import com.eainde.trace.model.SynergyCandidate;

import java.util.Optional;

/**
 * Everything a generation attempt is built from. Stateless between attempts.
 *
 * @param primarySynergy selected synergy, {@code null} when analysis produced none
 */
public record HypothesisContext(
        DocumentRecord paperA,
        DocumentRecord paperB,
        SynergyAnalysis synergyAnalysis,
        SynergyCandidate primarySynergy,
        GroundingReference reference
) {

    public Optional<SynergyCandidate> primary() {
        return Optional.ofNullable(primarySynergy);
    }

    public String fallbackSynergyId() {
        return primarySynergy == null ? null : primarySynergy.id();
    }
}
