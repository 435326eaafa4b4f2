package com.eainde.trace.state;

import com.eainde.trace.capability.SourceDocument;
import com.eainde.trace.error.ErrorType;
import com.eainde.trace.model.AttestationRecord;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.model.DocumentRecord;
import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.model.KnowledgeGraph;
import com.eainde.trace.model.SynergyAnalysis;
import com.eainde.trace.model.SynergyCandidate;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Blackboard shared by all pipeline nodes. Nodes read through the typed getters and return
 * partial updates keyed by the constants below. Values are never {@code null}; an absent key
 * means "not produced yet".
 */
public class PipelineState extends AgentState {

    public static final String RUN_ID = "run_id";
    public static final String INPUT_FOLDER = "input_folder";
    public static final String AUTHOR = "author";
    public static final String PAPER_A_TEXT = "paper_a_text";
    public static final String PAPER_A_TITLE = "paper_a_title";
    public static final String PAPER_B_TEXT = "paper_b_text";
    public static final String PAPER_B_TITLE = "paper_b_title";
    public static final String DOCUMENT_A = "document_a";
    public static final String DOCUMENT_B = "document_b";
    public static final String EXTRACT_A_ERROR = "extract_a_error";
    public static final String EXTRACT_B_ERROR = "extract_b_error";
    public static final String KNOWLEDGE_GRAPH = "knowledge_graph";
    public static final String SYNERGY_ANALYSIS = "synergy_analysis";
    public static final String PRIMARY_SYNERGY = "primary_synergy";
    public static final String HYPOTHESIS = "hypothesis";
    public static final String GENERATION_ATTEMPTS = "generation_attempts";
    public static final String HYPOTHESIS_REPAIRED = "hypothesis_repaired";
    public static final String ATTESTATION = "attestation";
    public static final String ERROR = "error";
    public static final String ERROR_PHASE = "error_phase";
    public static final String ERROR_TYPE = "error_type";
    public static final String PIPELINE_STARTED_AT = "pipeline_started_at";

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    public Optional<String> getRunId() { return value(RUN_ID); }
    public Optional<String> getInputFolder() { return value(INPUT_FOLDER); }
    public Optional<String> getAuthor() { return value(AUTHOR); }

    public Optional<String> getPaperText(DocumentOrigin origin) {
        return value(origin == DocumentOrigin.A ? PAPER_A_TEXT : PAPER_B_TEXT);
    }

    public Optional<String> getPaperTitle(DocumentOrigin origin) {
        return value(origin == DocumentOrigin.A ? PAPER_A_TITLE : PAPER_B_TITLE);
    }

    public Optional<DocumentRecord> getDocument(DocumentOrigin origin) {
        return value(documentKey(origin));
    }

    public Optional<NodeFailure> getExtractionFailure(DocumentOrigin origin) {
        return value(extractionErrorKey(origin));
    }

    public Optional<KnowledgeGraph> getKnowledgeGraph() { return value(KNOWLEDGE_GRAPH); }
    public Optional<SynergyAnalysis> getSynergyAnalysis() { return value(SYNERGY_ANALYSIS); }
    public Optional<SynergyCandidate> getPrimarySynergy() { return value(PRIMARY_SYNERGY); }
    public Optional<HypothesisRecord> getHypothesis() { return value(HYPOTHESIS); }
    public Optional<AttestationRecord> getAttestation() { return value(ATTESTATION); }

    public int getGenerationAttempts() {
        return this.<Integer>value(GENERATION_ATTEMPTS).orElse(0);
    }

    public boolean isHypothesisRepaired() {
        return this.<Boolean>value(HYPOTHESIS_REPAIRED).orElse(false);
    }

    public Optional<String> getError() {
        return this.<String>value(ERROR).filter(error -> !error.isEmpty());
    }

    public boolean hasError() {
        return getError().isPresent();
    }

    public Optional<String> getErrorPhase() { return value(ERROR_PHASE); }

    public Optional<ErrorType> getErrorType() {
        return this.<String>value(ERROR_TYPE).map(ErrorType::valueOf);
    }

    public Optional<Instant> getStartedAt() { return value(PIPELINE_STARTED_AT); }

    public static String documentKey(DocumentOrigin origin) {
        return origin == DocumentOrigin.A ? DOCUMENT_A : DOCUMENT_B;
    }

    public static String extractionErrorKey(DocumentOrigin origin) {
        return origin == DocumentOrigin.A ? EXTRACT_A_ERROR : EXTRACT_B_ERROR;
    }

    public static Map<String, Object> documents(SourceDocument a, SourceDocument b) {
        return Map.of(
                PAPER_A_TEXT, a.text(),
                PAPER_A_TITLE, a.title(),
                PAPER_B_TEXT, b.text(),
                PAPER_B_TITLE, b.title());
    }
}
