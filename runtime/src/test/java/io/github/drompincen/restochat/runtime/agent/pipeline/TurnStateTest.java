package io.github.drompincen.restochat.runtime.agent.pipeline;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.Intent;
import io.github.drompincen.restochat.protocol.api.Persona;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnStateTest {

    private final TurnState start = TurnState.start("t1", Persona.INTERNAL,
            List.of(ChatMessage.user("earlier"), ChatMessage.assistant("reply")), "summary", null, "now");

    @Test
    void startAppendsUserMessage() {
        assertThat(start.turnMessages()).containsExactly(ChatMessage.user("now"));
        assertThat(start.messages()).hasSize(3).last().isEqualTo(ChatMessage.user("now"));
    }

    @Test
    void toolResultAndReplyAreAppendedInOrder() {
        TurnState done = start.withToolResult("{\"count\": 1}").withReply("One item.");

        assertThat(done.turnMessages()).containsExactly(
                ChatMessage.user("now"), ChatMessage.tool("{\"count\": 1}"), ChatMessage.assistant("One item."));
        assertThat(start.turnMessages()).hasSize(1);
    }

    @Test
    void onlyOneReplyPerTurn() {
        TurnState replied = start.withReply("first");

        assertThatThrownBy(() -> replied.withReply("second")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void intentIsSetOnce() {
        TurnState classified = start.withIntent(Intent.DB_QUERY);

        assertThatThrownBy(() -> classified.withIntent(Intent.CONVERSATIONAL))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void clarificationAndToolRunExcludeEachOther() {
        assertThatThrownBy(() -> start.withClarifyQuestion("Which dish?").withToolResult("x"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> start.withToolResult("x").withClarifyQuestion("Which dish?"))
                .isInstanceOf(IllegalStateException.class);
    }
}
