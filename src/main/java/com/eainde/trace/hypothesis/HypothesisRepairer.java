package com.eainde.trace.hypothesis;

import com.eainde.trace.model.Confidence;
import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.model.SourceSupport;
import com.eainde.trace.model.ValidationResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Mechanical repair of a hypothesis that failed grounding.
 *
 * <p>Invalid claim ids and variables are removed (survivors keep their order) and an unknown
 * primary synergy is replaced. If the record still cannot be grounded, confidence drops to
 * {@code low} and {@link #UNGROUNDED_NOTE} is added once. Applying repair twice gives the same
 * record as applying it once.</p>
 */
@Log4j2
@Component
public class HypothesisRepairer {

    public static final String UNGROUNDED_NOTE =
            "Hypothesis could not be fully grounded in the input documents after repair";

    private final GroundingValidator validator;

    public HypothesisRepairer(GroundingValidator validator) {
        this.validator = validator;
    }

    /**
     * @param fallbackSynergyId synergy to use when the cited one is unknown; ignored if not itself known
     */
    public HypothesisRecord repair(HypothesisRecord record, GroundingReference reference, String fallbackSynergyId) {
        SourceSupport support = record.sourceSupport();
        SourceSupport stripped = new SourceSupport(
                keepKnown(support.paperAClaimIds(), reference.paperAClaimIds()),
                keepKnown(support.paperBClaimIds(), reference.paperBClaimIds()),
                support.variablesUsed().stream().filter(reference::isKnownVariable).toList());

        HypothesisRecord repaired = record.withSourceSupport(stripped);
        if (!reference.isKnownSynergy(repaired.primarySynergyId())) {
            String replacement = replacementSynergy(reference, fallbackSynergyId);
            if (replacement != null) {
                log.warn("Replacing unknown primary synergy '{}' with '{}'", repaired.primarySynergyId(), replacement);
                repaired = repaired.withPrimarySynergyId(replacement);
            }
        }

        ValidationResult check = validator.validate(repaired, reference);
        if (!check.valid()) {
            log.warn("Hypothesis {} still ungrounded after repair: {}", repaired.hypothesisId(), check.errors());
            repaired = repaired.withConfidence(Confidence.LOW);
            if (!repaired.riskNotes().contains(UNGROUNDED_NOTE)) {
                repaired = repaired.withRiskNote(UNGROUNDED_NOTE);
            }
        }
        return repaired;
    }

    private static String replacementSynergy(GroundingReference reference, String fallbackSynergyId) {
        if (reference.isKnownSynergy(fallbackSynergyId)) {
            return fallbackSynergyId;
        }
        return reference.synergyIds().isEmpty() ? null : reference.synergyIds().get(0);
    }

    private static List<String> keepKnown(List<String> ids, Set<String> known) {
        return ids.stream().filter(known::contains).toList();
    }
}
