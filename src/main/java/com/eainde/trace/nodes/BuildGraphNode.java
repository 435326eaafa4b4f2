package com.eainde.trace.nodes;

import com.eainde.trace.graph.DocumentGraphBuilder;
import com.eainde.trace.graph.GraphEnhancer;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.SynergyAnalysis;
import com.eainde.trace.model.SynergyCandidate;
import com.eainde.trace.state.NodeFailure;
import com.eainde.trace.state.PipelineState;
import com.eainde.trace.synergy.SynergyAnalyzer;
import com.eainde.trace.synergy.SynergySelector;
import lombok.extern.log4j.Log4j2;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Join point after extraction: promotes the first extraction failure (A before B), otherwise
 * builds the graph, runs synergy analysis, enhances the graph and selects the primary synergy.
 */
@Log4j2
public class BuildGraphNode extends AbstractPipelineNode {

    private final DocumentGraphBuilder graphBuilder;
    private final SynergyAnalyzer synergyAnalyzer;
    private final GraphEnhancer graphEnhancer;
    private final SynergySelector synergySelector;

    public BuildGraphNode(DocumentGraphBuilder graphBuilder,
                          SynergyAnalyzer synergyAnalyzer,
                          GraphEnhancer graphEnhancer,
                          SynergySelector synergySelector) {
        super(PipelinePhase.BUILD_GRAPH);
        this.graphBuilder = graphBuilder;
        this.synergyAnalyzer = synergyAnalyzer;
        this.graphEnhancer = graphEnhancer;
        this.synergySelector = synergySelector;
    }

    @Override
    protected CompletableFuture<Map<String, Object>> process(PipelineState state) {
        Optional<NodeFailure> extractionFailure = state.getExtractionFailure(DocumentOrigin.A)
                .or(() -> state.getExtractionFailure(DocumentOrigin.B));
        if (extractionFailure.isPresent()) {
            log.warn("[build_graph] promoting extraction failure from {}", extractionFailure.get().phase());
            return CompletableFuture.completedFuture(extractionFailure.get().toErrorUpdate());
        }

        DocumentRecord a = state.getDocument(DocumentOrigin.A).orElse(null);
        DocumentRecord b = state.getDocument(DocumentOrigin.B).orElse(null);

        KnowledgeGraph graph = graphBuilder.build(a, b);
        SynergyAnalysis analysis = synergyAnalyzer.analyze(a, b);
        KnowledgeGraph enhanced = graphEnhancer.enhance(graph, analysis);
        Optional<SynergyCandidate> primary =
                synergySelector.select(analysis.potentialSynergies(), analysis.overlappingVariables());

        log.info("[build_graph] {} nodes, {} edges, primary synergy {}",
                enhanced.nodeCount(), enhanced.edgeCount(), primary.map(SynergyCandidate::id).orElse("none"));

        Map<String, Object> update = new HashMap<>();
        update.put(PipelineState.KNOWLEDGE_GRAPH, enhanced);
        update.put(PipelineState.SYNERGY_ANALYSIS, analysis);
        primary.ifPresent(synergy -> update.put(PipelineState.PRIMARY_SYNERGY, synergy));
        return CompletableFuture.completedFuture(update);
    }
}
