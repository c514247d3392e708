package io.github.drompincen.restochat.runtime.agent.llm;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.MessageRole;

import java.util.List;

public record LlmRequest(
        LlmPurpose purpose,
        List<ChatMessage> messages,
        double temperature
) {
    public LlmRequest {
        messages = List.copyOf(messages);
    }

    /** Content of the last user-role message, or empty. */
    public String lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage m = messages.get(i);
            if (m.role() == MessageRole.USER) {
                return m.content() != null ? m.content() : "";
            }
        }
        return "";
    }
}
