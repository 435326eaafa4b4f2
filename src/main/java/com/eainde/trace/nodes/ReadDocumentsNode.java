package com.eainde.trace.nodes;

import com.eainde.trace.capability.DocumentSource;
import com.eainde.trace.capability.SourceDocument;
import com.eainde.trace.error.InputValidationException;
import com.eainde.trace.state.PipelineState;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.eainde.trace.model.DocumentOrigin.A;
import static com.eainde.trace.model.DocumentOrigin.B;

/**
 * Loads both document texts unless the caller already supplied them.
 */
@Log4j2
public class ReadDocumentsNode extends AbstractPipelineNode {

    private final DocumentSource source;

    public ReadDocumentsNode(DocumentSource source) {
        super(PipelinePhase.READ_DOCUMENTS);
        this.source = source;
    }

    @Override
    protected CompletableFuture<Map<String, Object>> process(PipelineState state) {
        if (state.getPaperText(A).isPresent() && state.getPaperText(B).isPresent()) {
            log.debug("[read_documents] texts supplied by caller");
            return CompletableFuture.completedFuture(Map.of());
        }
        String folder = state.getInputFolder()
                .orElseThrow(() -> new InputValidationException("Either both document texts or an input folder are required"));
        List<SourceDocument> documents = source.read(folder);
        return CompletableFuture.completedFuture(PipelineState.documents(documents.get(0), documents.get(1)));
    }
}
