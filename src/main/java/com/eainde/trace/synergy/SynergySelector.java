package com.eainde.trace.synergy;

import com.eainde.trace.model.SynergyCandidate;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the synergy a hypothesis should build on.
 *
 * <p>Score = number of distinct overlapping variable names mentioned (case-insensitive) in the description
 * plus half the total support size. Highest score wins; ties go to the earliest candidate.</p>
 */
@Log4j2
@Component
public class SynergySelector {

    private static final double SUPPORT_WEIGHT = 0.5;

    public Optional<SynergyCandidate> select(List<SynergyCandidate> candidates,
                                             Collection<String> overlappingVariables) {
        if (candidates == null || candidates.isEmpty()) {
            log.warn("No synergy candidates to select from");
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }

        SynergyCandidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (SynergyCandidate candidate : candidates) {
            double score = score(candidate, overlappingVariables);
            log.debug("Synergy {} scored {}", candidate.id(), score);
            // strict comparison keeps the earliest candidate on ties
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    double score(SynergyCandidate candidate, Collection<String> overlappingVariables) {
        String description = candidate.description().toLowerCase(Locale.ROOT);
        long mentions = overlappingVariables == null ? 0 : overlappingVariables.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.toLowerCase(Locale.ROOT))
                .distinct()
                .filter(description::contains)
                .count();
        return mentions + SUPPORT_WEIGHT * candidate.supportSize();
    }
}
