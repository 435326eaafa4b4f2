package com.eainde.trace.graph;

import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.GraphEdge;
import com.eainde.trace.model.GraphNode;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.NodeType;
import com.eainde.trace.model.SynergyAnalysis;
import com.eainde.trace.model.SynergyCandidate;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Augments a base graph with the results of synergy analysis.
 *
 * <ul>
 *   <li>one {@code both} variable node per overlapping variable, skipped if the id exists</li>
 *   <li>for every synergy and conflict, one edge per (A support, B support) pair</li>
 * </ul>
 * Support ids are linked as given; they are not checked against the node set here.
 */
@Log4j2
@Component
public class GraphEnhancer {

    public KnowledgeGraph enhance(KnowledgeGraph graph, SynergyAnalysis analysis) {
        List<String> missing = analysis.missingFields();
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing.stream().map(f -> "synergy_analysis." + f).toList());
        }

        KnowledgeGraph.Builder enhanced = graph.toBuilder();

        int overlapNodes = 0;
        for (String variable : analysis.overlappingVariables()) {
            GraphNode node = new GraphNode(overlapVariableId(variable), NodeType.VARIABLE, DocumentOrigin.BOTH, variable);
            if (enhanced.addNodeIfAbsent(node)) {
                overlapNodes++;
            }
        }

        int synergyEdges = addCrossProductEdges(enhanced, analysis.potentialSynergies(), GraphEdge::synergy);
        int conflictEdges = addCrossProductEdges(enhanced, analysis.potentialConflicts(), GraphEdge::conflict);

        log.debug("Graph enhanced: +{} overlap nodes, +{} synergy edges, +{} conflict edges",
                overlapNodes, synergyEdges, conflictEdges);
        return enhanced.build();
    }

    /** {@code var_} + lower-case name with spaces replaced by underscores. */
    public static String overlapVariableId(String variableName) {
        return "var_" + variableName.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private int addCrossProductEdges(KnowledgeGraph.Builder graph,
                                     List<SynergyCandidate> relations,
                                     EdgeFactory factory) {
        int added = 0;
        for (SynergyCandidate relation : relations) {
            for (String aClaim : relation.paperASupport()) {
                for (String bClaim : relation.paperBSupport()) {
                    graph.addEdge(factory.create(aClaim, bClaim, relation.id()));
                    added++;
                }
            }
        }
        return added;
    }

    @FunctionalInterface
    private interface EdgeFactory {
        GraphEdge create(String source, String target, String relationId);
    }
}
