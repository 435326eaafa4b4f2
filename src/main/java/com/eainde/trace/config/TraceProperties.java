package com.eainde.trace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code trace.*}. Defaults live in {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "trace")
public class TraceProperties {

    /** Recorded as the attestation author when a request names none. */
    private String author = "anonymous";

    /** When set, the application runs the pipeline once over this folder at startup. */
    private String inputFolder;

    private Pipeline pipeline = new Pipeline();
    private Llm llm = new Llm();
    private Registry registry = new Registry();

    @Data
    public static class Pipeline {
        /** {@code graph} or {@code sequential}. */
        private String strategy = "graph";
        private Duration capabilityTimeout = Duration.ofSeconds(120);
        private int maxRetries = 2;
        /** Worker threads kept alive between runs; more are created on demand. */
        private int workerThreads = 4;
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String apiKey;
        private String modelName = "llama-3.3-70b-versatile";
        private double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(90);
    }

    @Data
    public static class Registry {
        private String directory = "data/hypotheses";
    }
}
