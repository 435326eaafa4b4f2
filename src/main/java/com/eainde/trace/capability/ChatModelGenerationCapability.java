package com.eainde.trace.capability;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

/**
 * {@link GenerationCapability} backed by one LangChain4j {@link ChatModel}.
 * The model is built once at composition time and shared read-only by every caller.
 */
@Log4j2
public class ChatModelGenerationCapability implements GenerationCapability {

    private static final String SYSTEM_PROMPT = "Return STRICT JSON only. Do not add commentary.";

    private final ChatModel chatModel;

    public ChatModelGenerationCapability(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String generate(String prompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt))
                .build();
        ChatResponse response = chatModel.chat(request);
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        log.debug("Generation returned {} chars (finish reason {})",
                text != null ? text.length() : 0, response.finishReason());
        return text != null ? text : "";
    }
}
