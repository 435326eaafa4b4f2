package com.eainde.trace.nodes;

import com.eainde.trace.error.OrchestrationException;
import com.eainde.trace.error.PipelineException;
import com.eainde.trace.state.NodeFailure;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Common error policy for pipeline nodes.
 *
 * <ul>
 *   <li>If an upstream node already recorded an error, the node returns an empty update.</li>
 *   <li>Any failure of {@link #process} is logged and turned into an error update
 *       ({@link #failureUpdate}); the returned future never completes exceptionally.</li>
 * </ul>
 */
@Log4j2
public abstract class AbstractPipelineNode implements AsyncNodeAction<PipelineState> {

    private final PipelinePhase phase;

    protected AbstractPipelineNode(PipelinePhase phase) {
        this.phase = phase;
    }

    public PipelinePhase getPhase() {
        return phase;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(PipelineState state) {
        if (state.hasError()) {
            log.debug("[{}] skipped, upstream error in {}", phase.nodeId(), state.getErrorPhase().orElse("?"));
            return CompletableFuture.completedFuture(Map.of());
        }
        log.info("[{}] started", phase.nodeId());
        try {
            return process(state)
                    .thenApply(update -> {
                        log.info("[{}] completed", phase.nodeId());
                        return update;
                    })
                    .exceptionally(error -> fail(unwrap(error)));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(fail(e));
        }
    }

    protected abstract CompletableFuture<Map<String, Object>> process(PipelineState state);

    /**
     * State update recording {@code failure}. Writes the run error by default.
     */
    protected Map<String, Object> failureUpdate(NodeFailure failure) {
        return failure.toErrorUpdate();
    }

    private Map<String, Object> fail(Throwable error) {
        Throwable reported = error instanceof PipelineException
                ? error
                : new OrchestrationException(phase.nodeId(), String.valueOf(error.getMessage()), error);
        log.error("[{}] failed: {}", phase.nodeId(), reported.getMessage(), error);
        return failureUpdate(NodeFailure.of(phase.nodeId(), reported));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
