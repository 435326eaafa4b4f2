package com.eainde.trace.workflow;

import com.eainde.trace.error.ErrorType;
import com.eainde.trace.error.PipelineException;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Entry point for pipeline runs.
 * <p>
 * Assigns the run id (also put in the logging MDC as {@value #MDC_RUN_ID}), seeds the
 * blackboard, hands it to the configured {@link PipelineExecutor} and turns the final state into
 * a {@link PipelineResult}. Failures never escape as exceptions; they come back as a
 * {@code FAILED} result naming the phase.
 * </p>
 */
@Log4j2
public class PipelineOrchestrator {

    public static final String MDC_RUN_ID = "runId";

    private final PipelineExecutor executor;
    private final Clock clock;

    public PipelineOrchestrator(PipelineExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    public PipelineResult run(PipelineRequest request) {
        String runId = request.runId() != null ? request.runId() : UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        Instant startedAt = clock.instant();
        try {
            log.info("Pipeline run {} started ({} strategy)", runId, executor.name());
            PipelineState finalState = executor.execute(request.toInitialState(runId, startedAt));
            PipelineResult result = PipelineResult.from(finalState, runId, executor.name(), startedAt, clock.instant());
            if (result.succeeded()) {
                log.info("Pipeline run {} succeeded: {} ({})", runId,
                        result.hypothesis().hypothesisId(), result.attestation().contentHash());
            } else {
                log.warn("Pipeline run {} failed in {}: {}", runId, result.errorPhase(), result.errorMessage());
            }
            return result;
        } catch (PipelineException e) {
            log.error("Pipeline run {} aborted", runId, e);
            return PipelineResult.failed(runId, executor.name(), e.getPhase(), ErrorType.of(e), e.getMessage(),
                    startedAt, clock.instant());
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    public String getStrategy() {
        return executor.name();
    }
}
