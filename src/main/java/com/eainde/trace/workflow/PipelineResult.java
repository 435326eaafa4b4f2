package com.eainde.trace.workflow;

import com.eainde.trace.error.ErrorType;
import com.eainde.trace.model.AttestationRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.state.PipelineState;

import java.time.Instant;

/**
 * What a caller sees after a run.
 * <p>
 * {@code FAILED} carries the failing phase, the error type and message, and no hypothesis.
 * {@code SUCCEEDED} carries the hypothesis and its attestation; {@code caveated} marks a
 * low-confidence hypothesis with risk notes, which is still a success.
 * </p>
 */
public record PipelineResult(
        Status status,
        String runId,
        String strategy,
        HypothesisRecord hypothesis,
        AttestationRecord attestation,
        int generationAttempts,
        boolean caveated,
        String errorPhase,
        ErrorType errorType,
        String errorMessage,
        Instant startedAt,
        Instant completedAt
) {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }

    static PipelineResult failed(String runId, String strategy, String phase, ErrorType type, String message,
                                 Instant startedAt, Instant completedAt) {
        return new PipelineResult(Status.FAILED, runId, strategy, null, null, 0, false,
                phase, type, message, startedAt, completedAt);
    }

    static PipelineResult from(PipelineState state, String runId, String strategy, Instant startedAt, Instant completedAt) {
        if (state.hasError()) {
            return failed(runId, strategy,
                    state.getErrorPhase().orElse(null),
                    state.getErrorType().orElse(ErrorType.ORCHESTRATION),
                    state.getError().orElse(null),
                    startedAt, completedAt);
        }
        HypothesisRecord hypothesis = state.getHypothesis().orElse(null);
        AttestationRecord attestation = state.getAttestation().orElse(null);
        if (hypothesis == null || attestation == null) {
            return failed(runId, strategy, null, ErrorType.ORCHESTRATION,
                    "Pipeline finished without an attested hypothesis", startedAt, completedAt);
        }
        return new PipelineResult(Status.SUCCEEDED, runId, strategy, hypothesis, attestation,
                state.getGenerationAttempts(), hypothesis.isCaveated(),
                null, null, null, startedAt, completedAt);
    }
}
