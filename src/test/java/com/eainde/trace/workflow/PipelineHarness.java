package com.eainde.trace.workflow;

import com.eainde.trace.Fixtures;
import com.eainde.trace.attestation.AttestationService;
import com.eainde.trace.attestation.Canonicalizer;
import com.eainde.trace.attestation.ContentHasher;
import com.eainde.trace.attestation.FileHypothesisRegistry;
import com.eainde.trace.attestation.InMemoryLedgerWriter;
import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.capability.ExtractionCapability;
import com.eainde.trace.capability.FolderDocumentSource;
import com.eainde.trace.capability.GenerationCapability;
import com.eainde.trace.capability.StructuredOutputParser;
import com.eainde.trace.graph.DocumentGraphBuilder;
import com.eainde.trace.graph.GraphEnhancer;
import com.eainde.trace.hypothesis.HypothesisGenerator;
import com.eainde.trace.hypothesis.RetryCoordinators;
import com.eainde.trace.model.DocumentOrigin;
import com.eainde.trace.nodes.AttestNode;
import com.eainde.trace.nodes.BuildGraphNode;
import com.eainde.trace.nodes.ExtractDocumentNode;
import com.eainde.trace.nodes.GenerateHypothesisNode;
import com.eainde.trace.nodes.PipelineNodes;
import com.eainde.trace.nodes.ReadDocumentsNode;
import com.eainde.trace.synergy.SynergyAnalyzer;
import com.eainde.trace.synergy.SynergySelector;
import com.eainde.trace.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires a complete pipeline around scripted capabilities, a fixed clock and predictable ids, so
 * two harnesses built from the same inputs produce identical runs.
 */
class PipelineHarness {

    static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    static final String PAPER_A_TEXT = "Paper A. Thermal cycling improves cell lifetime.";
    static final String PAPER_B_TEXT = "Paper B. Impedance rises with temperature.";

    /** Answers synergy prompts with the fixture analysis and hypothesis prompts with a grounded card. */
    static final GenerationCapability GROUNDED = prompt -> prompt.contains("scientific analysis agent")
            ? Fixtures.analysisJson()
            : Fixtures.groundedCardJson();

    /** Maps paper texts onto the fixture records. */
    static final ExtractionCapability FIXTURE_EXTRACTION = (text, title) -> text.startsWith("Paper A")
            ? Fixtures.paperA()
            : Fixtures.paperB();

    final MdcAwareExecutor executor = new MdcAwareExecutor(2);
    final InMemoryLedgerWriter ledger;
    final FileHypothesisRegistry registry;
    final PipelineNodes nodes;

    PipelineHarness(Path registryDirectory, ExtractionCapability extraction, GenerationCapability generation,
                    Duration timeout) {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CapabilityInvoker invoker = new CapabilityInvoker(executor, timeout);
        StructuredOutputParser parser = new StructuredOutputParser();
        ContentHasher hasher = new ContentHasher();

        ledger = new InMemoryLedgerWriter(hasher, clock);
        registry = new FileHypothesisRegistry(registryDirectory, mapper);
        AttestationService attestation = new AttestationService(new Canonicalizer(mapper), hasher,
                registry, ledger, invoker, mapper, clock);

        nodes = new PipelineNodes(
                new ReadDocumentsNode(new FolderDocumentSource()),
                new ExtractDocumentNode(DocumentOrigin.A, extraction, invoker, executor),
                new ExtractDocumentNode(DocumentOrigin.B, extraction, invoker, executor),
                new BuildGraphNode(new DocumentGraphBuilder(), new SynergyAnalyzer(generation, invoker, parser),
                        new GraphEnhancer(), new SynergySelector()),
                new GenerateHypothesisNode(RetryCoordinators.withSequentialIds(
                        new HypothesisGenerator(generation, invoker, parser), 2)),
                new AttestNode(attestation, "trace-pipeline"));
    }

    PipelineHarness(Path registryDirectory) {
        this(registryDirectory, FIXTURE_EXTRACTION, GROUNDED, Duration.ofSeconds(5));
    }

    PipelineOrchestrator orchestrator(PipelineExecutor strategy) {
        return new PipelineOrchestrator(strategy, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    static PipelineRequest request() {
        return PipelineRequest.fromTexts(PAPER_A_TEXT, PAPER_B_TEXT, "alice").withRunId("run-1");
    }

    void close() {
        executor.close();
    }
}
