package io.github.drompincen.restochat.runtime.agent.llm;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.core.env.Environment;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiLlmServiceTest {

    @Mock
    private ChatModel chatModel;

    @Mock
    private Environment environment;

    private static final LlmRequest REQUEST = new LlmRequest(LlmPurpose.RESPOND,
            List.of(ChatMessage.system("be nice"), ChatMessage.user("hi")), 0.3);

    @Test
    void mapsRolesToSpringAiMessages() {
        List<Message> messages = SpringAiLlmService.toMessages(List.of(
                ChatMessage.system("s"), ChatMessage.user("u"), ChatMessage.assistant("a"), ChatMessage.tool("t")));

        assertThat(messages).extracting(Message::getMessageType).containsExactly(
                MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT, MessageType.SYSTEM);
        assertThat(messages.get(3).getText()).isEqualTo("t");
    }

    @Test
    void callsModelWithRequestTemperature() {
        when(environment.getProperty("spring.ai.openai.api-key", "")).thenReturn("sk-test-123");
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("Hello!")))));
        SpringAiLlmService service = new SpringAiLlmService(chatModel, environment);

        assertThat(service.blockingResponse(REQUEST)).isEqualTo("Hello!");

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertThat(prompt.getValue().getOptions().getTemperature()).isEqualTo(0.3);
        assertThat(prompt.getValue().getInstructions()).hasSize(2);
    }

    @Test
    void placeholderKeyIsNotAvailable() {
        when(environment.getProperty("spring.ai.openai.api-key", "")).thenReturn("sk-placeholder");
        SpringAiLlmService service = new SpringAiLlmService(chatModel, environment);

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.blockingResponse(REQUEST))
                .isInstanceOf(ModelCallException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void missingModelIsNotAvailable() {
        SpringAiLlmService service = new SpringAiLlmService(null, environment);

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.blockingResponse(REQUEST)).isInstanceOf(ModelCallException.class);
    }
}
