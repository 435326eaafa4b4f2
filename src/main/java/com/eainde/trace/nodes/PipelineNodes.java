package com.eainde.trace.nodes;

import java.util.List;

/**
 * The six pipeline nodes, shared by both execution strategies.
 */
public record PipelineNodes(
        ReadDocumentsNode readDocuments,
        ExtractDocumentNode extractA,
        ExtractDocumentNode extractB,
        BuildGraphNode buildGraph,
        GenerateHypothesisNode generateHypothesis,
        AttestNode attest
) {

    /** Topological order. */
    public List<AbstractPipelineNode> inOrder() {
        return List.of(readDocuments, extractA, extractB, buildGraph, generateHypothesis, attest);
    }
}
