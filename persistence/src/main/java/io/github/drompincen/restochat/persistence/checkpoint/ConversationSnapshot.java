package io.github.drompincen.restochat.persistence.checkpoint;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.Persona;

import java.util.List;

/**
 * Latest saved state of one thread: the persona that owns it, its message history and
 * rolling summary. {@code persona} is null only for rows written before it was recorded.
 */
public record ConversationSnapshot(
        Persona persona,
        List<ChatMessage> messages,
        String summary
) {
    public ConversationSnapshot {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public ConversationSnapshot(List<ChatMessage> messages, String summary) {
        this(null, messages, summary);
    }

    public static ConversationSnapshot empty() {
        return new ConversationSnapshot(null, List.of(), null);
    }

    /** True when the thread has no recorded owner yet or is owned by {@code caller}. */
    public boolean ownedBy(Persona caller) {
        return persona == null || persona == caller;
    }

    /** Last {@code size} messages, oldest first. */
    public List<ChatMessage> window(int size) {
        if (messages.size() <= size) return messages;
        return messages.subList(messages.size() - size, messages.size());
    }
}
