package com.eainde.trace.workflow;

import com.eainde.trace.nodes.AbstractPipelineNode;
import com.eainde.trace.nodes.PipelineNodes;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;

import java.util.HashMap;
import java.util.Map;

/**
 * Runs the nodes one by one in topological order and stops scheduling as soon as the
 * blackboard carries an error.
 */
@Log4j2
public class SequentialPipelineExecutor implements PipelineExecutor {

    public static final String NAME = "sequential";

    private final PipelineNodes nodes;

    public SequentialPipelineExecutor(PipelineNodes nodes) {
        this.nodes = nodes;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PipelineState execute(Map<String, Object> initialState) {
        Map<String, Object> data = new HashMap<>(initialState);
        for (AbstractPipelineNode node : nodes.inOrder()) {
            PipelineState state = new PipelineState(data);
            if (state.hasError()) {
                log.info("Stopping before {}: error in {}", node.getPhase().nodeId(), state.getErrorPhase().orElse("?"));
                break;
            }
            data.putAll(node.apply(state).join());
        }
        return new PipelineState(data);
    }
}
