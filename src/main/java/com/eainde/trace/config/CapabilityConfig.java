package com.eainde.trace.config;

import com.eainde.trace.capability.ChatModelGenerationCapability;
import com.eainde.trace.capability.DocumentSource;
import com.eainde.trace.capability.ExtractionCapability;
import com.eainde.trace.capability.FolderDocumentSource;
import com.eainde.trace.capability.GenerationCapability;
import com.eainde.trace.capability.PromptedExtractionCapability;
import com.eainde.trace.capability.StructuredOutputParser;
import com.eainde.trace.observability.GenerationLoggingListener;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * External collaborators: the chat model and the capabilities built on it.
 * The model is created once and shared; transport retries are off because retrying is the
 * pipeline's decision.
 */
@Log4j2
@Configuration
public class CapabilityConfig {

    @Bean
    public GenerationLoggingListener generationLoggingListener() {
        return new GenerationLoggingListener();
    }

    @Bean
    public ChatModel chatModel(TraceProperties properties, GenerationLoggingListener listener) {
        TraceProperties.Llm llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("trace.llm.api-key is not set; generation calls will be rejected by {}", llm.getBaseUrl());
        }
        return OpenAiChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(llm.getApiKey())
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout())
                .maxRetries(0)
                .listeners(List.of(listener))
                .build();
    }

    @Bean
    public StructuredOutputParser structuredOutputParser() {
        return new StructuredOutputParser();
    }

    @Bean
    public GenerationCapability generationCapability(ChatModel chatModel) {
        return new ChatModelGenerationCapability(chatModel);
    }

    @Bean
    public ExtractionCapability extractionCapability(GenerationCapability generation, StructuredOutputParser parser) {
        return new PromptedExtractionCapability(generation, parser);
    }

    @Bean
    public DocumentSource documentSource() {
        return new FolderDocumentSource();
    }
}
