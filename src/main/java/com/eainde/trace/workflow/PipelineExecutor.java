package com.eainde.trace.workflow;

import com.eainde.trace.state.PipelineState;

import java.util.Map;

/**
 * Runs the pipeline nodes over one blackboard. Implementations must produce the same final
 * state for the same inputs.
 */
public interface PipelineExecutor {

    String name();

    PipelineState execute(Map<String, Object> initialState);
}
