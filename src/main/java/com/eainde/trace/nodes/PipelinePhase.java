package com.eainde.trace.nodes;

/**
 * Pipeline nodes in topological order. {@link #nodeId()} is both the graph node id and the
 * phase reported on failure.
 */
public enum PipelinePhase {
    READ_DOCUMENTS("read_documents"),
    EXTRACT_A("extract_a"),
    EXTRACT_B("extract_b"),
    BUILD_GRAPH("build_graph"),
    GENERATE_HYPOTHESIS("generate_hypothesis"),
    ATTEST("attest");

    private final String nodeId;

    PipelinePhase(String nodeId) {
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
