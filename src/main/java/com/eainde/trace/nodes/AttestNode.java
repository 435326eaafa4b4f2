package com.eainde.trace.nodes;

import com.eainde.trace.attestation.AttestationService;
import com.eainde.trace.error.OrchestrationException;
import com.eainde.trace.model.AttestationRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
public class AttestNode extends AbstractPipelineNode {

    private final AttestationService attestationService;
    private final String defaultAuthor;

    public AttestNode(AttestationService attestationService, String defaultAuthor) {
        super(PipelinePhase.ATTEST);
        this.attestationService = attestationService;
        this.defaultAuthor = defaultAuthor;
    }

    @Override
    protected CompletableFuture<Map<String, Object>> process(PipelineState state) {
        HypothesisRecord hypothesis = state.getHypothesis()
                .orElseThrow(() -> new OrchestrationException(getPhase().nodeId(), "Missing state value: " + PipelineState.HYPOTHESIS));
        String author = state.getAuthor().filter(a -> !a.isBlank()).orElse(defaultAuthor);

        AttestationRecord attestation = attestationService.attest(hypothesis, author);
        log.info("[attest] {} -> {}", attestation.hypothesisId(), attestation.contentHash());
        return CompletableFuture.completedFuture(Map.of(PipelineState.ATTESTATION, attestation));
    }
}
