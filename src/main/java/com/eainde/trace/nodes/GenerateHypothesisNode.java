package com.eainde.trace.nodes;

import com.eainde.trace.error.OrchestrationException;
import com.eainde.trace.hypothesis.GenerationOutcome;
import com.eainde.trace.hypothesis.GroundingReference;
import com.eainde.trace.hypothesis.HypothesisContext;
import com.eainde.trace.hypothesis.RetryCoordinator;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.SynergyAnalysis;
import com.eainde.trace.model.SynergyCandidate;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
public class GenerateHypothesisNode extends AbstractPipelineNode {

    public static final String NO_SYNERGY_NOTE = "No synergy candidates were identified between the documents";

    private final RetryCoordinator retryCoordinator;

    public GenerateHypothesisNode(RetryCoordinator retryCoordinator) {
        super(PipelinePhase.GENERATE_HYPOTHESIS);
        this.retryCoordinator = retryCoordinator;
    }

    @Override
    protected CompletableFuture<Map<String, Object>> process(PipelineState state) {
        DocumentRecord a = require(state.getDocument(DocumentOrigin.A).orElse(null), PipelineState.DOCUMENT_A);
        DocumentRecord b = require(state.getDocument(DocumentOrigin.B).orElse(null), PipelineState.DOCUMENT_B);
        KnowledgeGraph graph = require(state.getKnowledgeGraph().orElse(null), PipelineState.KNOWLEDGE_GRAPH);
        SynergyAnalysis analysis = require(state.getSynergyAnalysis().orElse(null), PipelineState.SYNERGY_ANALYSIS);
        SynergyCandidate primary = state.getPrimarySynergy().orElse(null);

        GroundingReference reference = GroundingReference.of(graph, a, b, analysis.potentialSynergies());
        GenerationOutcome outcome = retryCoordinator.run(new HypothesisContext(a, b, analysis, primary, reference));

        HypothesisRecord hypothesis = outcome.hypothesis();
        if (primary == null && !hypothesis.riskNotes().contains(NO_SYNERGY_NOTE)) {
            hypothesis = hypothesis.withRiskNote(NO_SYNERGY_NOTE);
        }
        log.info("[generate_hypothesis] {} after {} attempt(s), repaired={}, confidence={}",
                hypothesis.hypothesisId(), outcome.attempts(), outcome.repaired(), hypothesis.confidence().label());

        return CompletableFuture.completedFuture(Map.of(
                PipelineState.HYPOTHESIS, hypothesis,
                PipelineState.GENERATION_ATTEMPTS, outcome.attempts(),
                PipelineState.HYPOTHESIS_REPAIRED, outcome.repaired()));
    }

    private <T> T require(T value, String key) {
        if (value == null) {
            throw new OrchestrationException(getPhase().nodeId(), "Missing state value: " + key);
        }
        return value;
    }
}
