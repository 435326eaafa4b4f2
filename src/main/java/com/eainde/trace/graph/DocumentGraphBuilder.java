package com.eainde.trace.graph;

import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.GraphEdge;
import com.eainde.trace.model.GraphNode;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.NodeType;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the base knowledge graph from two documents.
 *
 * <h3>Node ids</h3>
 * <ul>
 *   <li>{@code A_claim_1 .. A_claim_n}, then {@code A_var_1 .. A_var_m}</li>
 *   <li>{@code B_claim_1 ..}, then {@code B_var_1 ..}</li>
 * </ul>
 *
 * <h3>Edges</h3>
 * Every claim is linked to every variable of the same document with {@code uses_variable}.
 * The extraction output carries no finer claim/variable linkage, so the full bipartite product
 * is the association.
 */
@Log4j2
@Component
public class DocumentGraphBuilder {

    public KnowledgeGraph build(DocumentRecord paperA, DocumentRecord paperB) {
        DocumentRecordValidator.requireComplete(paperA, paperB);

        KnowledgeGraph.Builder graph = KnowledgeGraph.builder();
        addDocument(graph, DocumentOrigin.A, paperA);
        addDocument(graph, DocumentOrigin.B, paperB);
        addUsesVariableEdges(graph, DocumentOrigin.A, paperA);
        addUsesVariableEdges(graph, DocumentOrigin.B, paperB);

        KnowledgeGraph built = graph.build();
        log.debug("Base graph built: {} nodes, {} edges", built.nodeCount(), built.edgeCount());
        return built;
    }

    public static String claimId(DocumentOrigin origin, int index) {
        return origin.idPrefix() + "_claim_" + (index + 1);
    }

    public static String variableId(DocumentOrigin origin, int index) {
        return origin.idPrefix() + "_var_" + (index + 1);
    }

    private void addDocument(KnowledgeGraph.Builder graph, DocumentOrigin origin, DocumentRecord document) {
        List<String> claims = document.claims();
        for (int i = 0; i < claims.size(); i++) {
            graph.addNode(new GraphNode(claimId(origin, i), NodeType.CLAIM, origin, claims.get(i)));
        }
        List<String> variables = document.variables();
        for (int j = 0; j < variables.size(); j++) {
            graph.addNode(new GraphNode(variableId(origin, j), NodeType.VARIABLE, origin, variables.get(j)));
        }
    }

    private void addUsesVariableEdges(KnowledgeGraph.Builder graph, DocumentOrigin origin, DocumentRecord document) {
        int claimCount = document.claims().size();
        int variableCount = document.variables().size();
        for (int i = 0; i < claimCount; i++) {
            for (int j = 0; j < variableCount; j++) {
                graph.addEdge(GraphEdge.usesVariable(claimId(origin, i), variableId(origin, j)));
            }
        }
    }
}
