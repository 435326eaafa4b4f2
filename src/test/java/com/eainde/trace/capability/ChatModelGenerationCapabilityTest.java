package com.eainde.trace.capability;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelGenerationCapabilityTest {

    @Mock
    private ChatModel chatModel;

    @Test
    void shouldSendSystemAndUserMessage() {
        // GIVEN
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("{\"ok\": true}")).build());

        // WHEN
        String text = new ChatModelGenerationCapability(chatModel).generate("describe");

        // THEN
        assertThat(text).isEqualTo("{\"ok\": true}");
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertThat(request.getValue().messages()).hasSize(2);
        assertThat(request.getValue().messages().get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((UserMessage) request.getValue().messages().get(1)).singleText()).isEqualTo("describe");
    }
}
