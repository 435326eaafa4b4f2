package com.eainde.trace.hypothesis;

import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.SynergyCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * The sets a hypothesis may legitimately reference: claim node ids per document, the variable
 * names of both documents and the known synergy ids.
 *
 * <p>Variable matching is case-insensitive; {@link #variables()} keeps the original spelling
 * for prompts.</p>
 */
public record GroundingReference(
        Set<String> paperAClaimIds,
        Set<String> paperBClaimIds,
        Set<String> variables,
        List<String> synergyIds
) {

    public GroundingReference {
        paperAClaimIds = Collections.unmodifiableSet(new TreeSet<>(paperAClaimIds));
        paperBClaimIds = Collections.unmodifiableSet(new TreeSet<>(paperBClaimIds));
        variables = Collections.unmodifiableSet(new TreeSet<>(variables));
        synergyIds = List.copyOf(synergyIds);
    }

    public static GroundingReference of(KnowledgeGraph graph,
                                        DocumentRecord a,
                                        DocumentRecord b,
                                        List<SynergyCandidate> synergies) {
        Set<String> variables = new LinkedHashSet<>();
        addVariables(variables, a);
        addVariables(variables, b);

        List<String> synergyIds = new ArrayList<>();
        if (synergies != null) {
            for (SynergyCandidate synergy : synergies) {
                if (!synergy.id().isBlank()) {
                    synergyIds.add(synergy.id());
                }
            }
        }
        return new GroundingReference(
                graph.claimIds(DocumentOrigin.A),
                graph.claimIds(DocumentOrigin.B),
                variables,
                synergyIds);
    }

    public boolean isKnownVariable(String name) {
        if (name == null) {
            return false;
        }
        String key = name.toLowerCase(Locale.ROOT);
        return variables.stream().anyMatch(v -> v.toLowerCase(Locale.ROOT).equals(key));
    }

    public boolean isKnownSynergy(String id) {
        return id != null && synergyIds.contains(id);
    }

    public List<String> sortedSynergyIds() {
        return new ArrayList<>(new TreeSet<>(synergyIds));
    }

    private static void addVariables(Set<String> target, DocumentRecord record) {
        if (record == null || record.variables() == null) {
            return;
        }
        for (String variable : record.variables()) {
            if (variable != null && !variable.isBlank()) {
                target.add(variable);
            }
        }
    }
}
