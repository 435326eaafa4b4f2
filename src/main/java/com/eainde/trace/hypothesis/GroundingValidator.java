package com.eainde.trace.hypothesis;

import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.model.SourceSupport;
import com.eainde.trace.model.ValidationResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks that everything a hypothesis cites exists in the input documents.
 *
 * <p>Each violated category yields one error naming the offending values. Side-effect free.</p>
 */
@Log4j2
@Component
public class GroundingValidator {

    public static final String MISSING_STATEMENT = "Missing hypothesis statement";

    public ValidationResult validate(HypothesisRecord record, GroundingReference reference) {
        List<String> errors = new ArrayList<>();
        boolean fixable = true;

        if (!reference.isKnownSynergy(record.primarySynergyId())) {
            errors.add("Invalid primary_synergy_id: " + record.primarySynergyId());
            // nothing to substitute
            if (reference.synergyIds().isEmpty()) {
                fixable = false;
            }
        }

        SourceSupport support = record.sourceSupport();
        List<String> invalidA = unknownIds(support.paperAClaimIds(), reference.paperAClaimIds());
        if (!invalidA.isEmpty()) {
            errors.add("Invalid Paper A claim IDs: " + invalidA);
        }
        List<String> invalidB = unknownIds(support.paperBClaimIds(), reference.paperBClaimIds());
        if (!invalidB.isEmpty()) {
            errors.add("Invalid Paper B claim IDs: " + invalidB);
        }

        List<String> invalidVariables = support.variablesUsed().stream()
                .filter(v -> !reference.isKnownVariable(v))
                .toList();
        if (!invalidVariables.isEmpty()) {
            errors.add("Invalid variables (not in input papers): " + invalidVariables);
        }

        if (record.hypothesis().isBlank()) {
            errors.add(MISSING_STATEMENT);
            fixable = false;
        }

        if (errors.isEmpty()) {
            return ValidationResult.ok();
        }
        log.debug("Grounding check of {} found {} problem(s), fixable={}", record.hypothesisId(), errors.size(), fixable);
        return ValidationResult.invalid(errors, fixable);
    }

    private static List<String> unknownIds(List<String> ids, Set<String> known) {
        return ids.stream().filter(id -> !known.contains(id)).toList();
    }
}
