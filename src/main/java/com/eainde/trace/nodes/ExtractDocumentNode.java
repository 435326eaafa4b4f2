package com.eainde.trace.nodes;

import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.capability.ExtractionCapability;
import com.eainde.trace.error.InputValidationException;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.state.NodeFailure;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Extracts one document on the worker pool. A and B run concurrently in graph mode, so a
 * failure goes to the document's own error key and is promoted later by {@link BuildGraphNode}.
 */
@Log4j2
public class ExtractDocumentNode extends AbstractPipelineNode {

    static final String CAPABILITY = "extraction";

    private final DocumentOrigin origin;
    private final ExtractionCapability extraction;
    private final CapabilityInvoker invoker;
    private final Executor executor;

    public ExtractDocumentNode(DocumentOrigin origin,
                               ExtractionCapability extraction,
                               CapabilityInvoker invoker,
                               Executor executor) {
        super(origin == DocumentOrigin.A ? PipelinePhase.EXTRACT_A : PipelinePhase.EXTRACT_B);
        this.origin = origin;
        this.extraction = extraction;
        this.invoker = invoker;
        this.executor = executor;
    }

    @Override
    protected CompletableFuture<Map<String, Object>> process(PipelineState state) {
        String text = state.getPaperText(origin)
                .filter(t -> !t.isBlank())
                .orElseThrow(() -> new InputValidationException("Paper " + origin.label() + " text is empty"));
        String title = state.getPaperTitle(origin).orElse("");

        return CompletableFuture.supplyAsync(() -> {
            DocumentRecord record = invoker.invoke(CAPABILITY, () -> extraction.extract(text, title));
            log.info("[{}] {} claims, {} variables", getPhase().nodeId(),
                    sizeOf(record.claims()), sizeOf(record.variables()));
            return Map.<String, Object>of(PipelineState.documentKey(origin), record);
        }, executor);
    }

    @Override
    protected Map<String, Object> failureUpdate(NodeFailure failure) {
        return Map.of(PipelineState.extractionErrorKey(origin), failure);
    }

    private static int sizeOf(List<String> values) {
        return values == null ? 0 : values.size();
    }
}
