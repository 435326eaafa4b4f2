package com.eainde.trace.workflow;

import com.eainde.trace.error.OrchestrationException;
import com.eainde.trace.nodes.PipelineNodes;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;

import java.util.Map;

import static com.eainde.trace.nodes.PipelinePhase.ATTEST;
import static com.eainde.trace.nodes.PipelinePhase.BUILD_GRAPH;
import static com.eainde.trace.nodes.PipelinePhase.EXTRACT_A;
import static com.eainde.trace.nodes.PipelinePhase.EXTRACT_B;
import static com.eainde.trace.nodes.PipelinePhase.GENERATE_HYPOTHESIS;
import static com.eainde.trace.nodes.PipelinePhase.READ_DOCUMENTS;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Runs the pipeline as a LangGraph4j graph:
 *
 * <pre>
 *   START -> read_documents -> extract_a --> build_graph -> generate_hypothesis -> attest -> END
 *                           -> extract_b -/
 * </pre>
 *
 * The two extraction nodes are parallel branches joined at {@code build_graph}.
 */
@Log4j2
public class GraphPipelineExecutor implements PipelineExecutor {

    public static final String NAME = "graph";

    private final CompiledGraph<PipelineState> graph;

    public GraphPipelineExecutor(PipelineNodes nodes) throws GraphStateException {
        this.graph = build(nodes);
    }

    static CompiledGraph<PipelineState> build(PipelineNodes nodes) throws GraphStateException {
        StateGraph<PipelineState> workflow = new StateGraph<>(PipelineState::new);

        workflow.addNode(READ_DOCUMENTS.nodeId(), nodes.readDocuments());
        workflow.addNode(EXTRACT_A.nodeId(), nodes.extractA());
        workflow.addNode(EXTRACT_B.nodeId(), nodes.extractB());
        workflow.addNode(BUILD_GRAPH.nodeId(), nodes.buildGraph());
        workflow.addNode(GENERATE_HYPOTHESIS.nodeId(), nodes.generateHypothesis());
        workflow.addNode(ATTEST.nodeId(), nodes.attest());

        workflow.addEdge(START, READ_DOCUMENTS.nodeId());
        // fan out
        workflow.addEdge(READ_DOCUMENTS.nodeId(), EXTRACT_A.nodeId());
        workflow.addEdge(READ_DOCUMENTS.nodeId(), EXTRACT_B.nodeId());
        // join
        workflow.addEdge(EXTRACT_A.nodeId(), BUILD_GRAPH.nodeId());
        workflow.addEdge(EXTRACT_B.nodeId(), BUILD_GRAPH.nodeId());
        workflow.addEdge(BUILD_GRAPH.nodeId(), GENERATE_HYPOTHESIS.nodeId());
        workflow.addEdge(GENERATE_HYPOTHESIS.nodeId(), ATTEST.nodeId());
        workflow.addEdge(ATTEST.nodeId(), END);

        return workflow.compile();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PipelineState execute(Map<String, Object> initialState) {
        try {
            return graph.invoke(initialState)
                    .orElseThrow(() -> new OrchestrationException(NAME, "Graph finished without a final state"));
        } catch (OrchestrationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Graph execution failed", e);
            throw new OrchestrationException(NAME, "Graph execution failed: " + e.getMessage(), e);
        }
    }
}
