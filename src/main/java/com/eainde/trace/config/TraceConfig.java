package com.eainde.trace.config;

import com.eainde.trace.attestation.AttestationService;
import com.eainde.trace.attestation.Canonicalizer;
import com.eainde.trace.attestation.ContentHasher;
import com.eainde.trace.attestation.FileHypothesisRegistry;
import com.eainde.trace.attestation.HypothesisRegistry;
import com.eainde.trace.attestation.InMemoryLedgerWriter;
import com.eainde.trace.attestation.LedgerWriter;
import com.eainde.trace.capability.CapabilityInvoker;
import com.eainde.trace.capability.DocumentSource;
import com.eainde.trace.capability.ExtractionCapability;
import com.eainde.trace.capability.GenerationCapability;
import com.eainde.trace.capability.StructuredOutputParser;
import com.eainde.trace.graph.DocumentGraphBuilder;
import com.eainde.trace.graph.GraphEnhancer;
import com.eainde.trace.hypothesis.GroundingValidator;
import com.eainde.trace.hypothesis.HypothesisGenerator;
import com.eainde.trace.hypothesis.HypothesisRepairer;
import com.eainde.trace.hypothesis.RetryCoordinator;
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
import com.eainde.trace.workflow.GraphPipelineExecutor;
import com.eainde.trace.workflow.PipelineExecutor;
import com.eainde.trace.workflow.PipelineOrchestrator;
import com.eainde.trace.workflow.SequentialPipelineExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Pipeline wiring. Every component receives its collaborators through the constructor.
 */
@Log4j2
@Configuration
@EnableConfigurationProperties(TraceProperties.class)
public class TraceConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor pipelineExecutorService(TraceProperties properties) {
        return new MdcAwareExecutor(properties.getPipeline().getWorkerThreads());
    }

    @Bean
    public CapabilityInvoker capabilityInvoker(MdcAwareExecutor executor, TraceProperties properties) {
        return new CapabilityInvoker(executor, properties.getPipeline().getCapabilityTimeout());
    }

    // --- synergy and hypothesis ---

    @Bean
    public SynergyAnalyzer synergyAnalyzer(GenerationCapability generation,
                                           CapabilityInvoker invoker,
                                           StructuredOutputParser parser) {
        return new SynergyAnalyzer(generation, invoker, parser);
    }

    @Bean
    public HypothesisGenerator hypothesisGenerator(GenerationCapability generation,
                                                   CapabilityInvoker invoker,
                                                   StructuredOutputParser parser) {
        return new HypothesisGenerator(generation, invoker, parser);
    }

    @Bean
    public RetryCoordinator retryCoordinator(HypothesisGenerator generator,
                                             GroundingValidator validator,
                                             HypothesisRepairer repairer,
                                             TraceProperties properties) {
        return new RetryCoordinator(generator, validator, repairer, properties.getPipeline().getMaxRetries());
    }

    // --- attestation ---

    @Bean
    public Canonicalizer canonicalizer(ObjectMapper objectMapper) {
        return new Canonicalizer(objectMapper);
    }

    @Bean
    public ContentHasher contentHasher() {
        return new ContentHasher();
    }

    @Bean
    public HypothesisRegistry hypothesisRegistry(TraceProperties properties, ObjectMapper objectMapper) {
        return new FileHypothesisRegistry(Paths.get(properties.getRegistry().getDirectory()), objectMapper);
    }

    @Bean
    public LedgerWriter ledgerWriter(ContentHasher hasher, Clock clock) {
        return new InMemoryLedgerWriter(hasher, clock);
    }

    @Bean
    public AttestationService attestationService(Canonicalizer canonicalizer,
                                                 ContentHasher hasher,
                                                 HypothesisRegistry registry,
                                                 LedgerWriter ledgerWriter,
                                                 CapabilityInvoker invoker,
                                                 ObjectMapper objectMapper,
                                                 Clock clock) {
        return new AttestationService(canonicalizer, hasher, registry, ledgerWriter, invoker, objectMapper, clock);
    }

    // --- pipeline ---

    @Bean
    public PipelineNodes pipelineNodes(DocumentSource documentSource,
                                       ExtractionCapability extraction,
                                       CapabilityInvoker invoker,
                                       MdcAwareExecutor executor,
                                       DocumentGraphBuilder graphBuilder,
                                       SynergyAnalyzer synergyAnalyzer,
                                       GraphEnhancer graphEnhancer,
                                       SynergySelector synergySelector,
                                       RetryCoordinator retryCoordinator,
                                       AttestationService attestationService,
                                       TraceProperties properties) {
        return new PipelineNodes(
                new ReadDocumentsNode(documentSource),
                new ExtractDocumentNode(DocumentOrigin.A, extraction, invoker, executor),
                new ExtractDocumentNode(DocumentOrigin.B, extraction, invoker, executor),
                new BuildGraphNode(graphBuilder, synergyAnalyzer, graphEnhancer, synergySelector),
                new GenerateHypothesisNode(retryCoordinator),
                new AttestNode(attestationService, properties.getAuthor()));
    }

    @Bean
    public PipelineExecutor pipelineExecutor(PipelineNodes nodes, TraceProperties properties) {
        return selectExecutor(properties.getPipeline().getStrategy(), nodes);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineExecutor pipelineExecutor, Clock clock) {
        return new PipelineOrchestrator(pipelineExecutor, clock);
    }

    /**
     * Graph strategy unless {@code sequential} is requested; falls back to sequential when the
     * graph does not compile.
     */
    static PipelineExecutor selectExecutor(String strategy, PipelineNodes nodes) {
        if (SequentialPipelineExecutor.NAME.equalsIgnoreCase(strategy)) {
            return new SequentialPipelineExecutor(nodes);
        }
        if (!GraphPipelineExecutor.NAME.equalsIgnoreCase(strategy)) {
            log.warn("Unknown pipeline strategy '{}', using {}", strategy, GraphPipelineExecutor.NAME);
        }
        try {
            return new GraphPipelineExecutor(nodes);
        } catch (GraphStateException e) {
            log.error("Pipeline graph failed to compile, falling back to sequential execution", e);
            return new SequentialPipelineExecutor(nodes);
        }
    }
}
