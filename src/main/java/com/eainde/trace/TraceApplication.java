package com.eainde.trace;

import com.eainde.trace.config.TraceProperties;
import com.eainde.trace.workflow.PipelineOrchestrator;
import com.eainde.trace.workflow.PipelineRequest;
import com.eainde.trace.workflow.PipelineResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@Log4j2
@SpringBootApplication
public class TraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "trace", name = "input-folder")
    public ApplicationRunner runOnce(PipelineOrchestrator orchestrator, TraceProperties properties) {
        return args -> {
            PipelineResult result = orchestrator.run(
                    PipelineRequest.fromFolder(properties.getInputFolder(), properties.getAuthor()));
            if (result.succeeded()) {
                log.info("Hypothesis {} attested with hash {}{}",
                        result.hypothesis().hypothesisId(),
                        result.attestation().contentHash(),
                        result.caveated() ? " (low confidence, see risk notes)" : "");
            } else {
                log.error("Run failed in {} [{}]: {}", result.errorPhase(), result.errorType(), result.errorMessage());
            }
        };
    }
}
