package io.github.drompincen.restochat.persistence.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.persistence.H2TestDatabase;
import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.MessageRole;
import io.github.drompincen.restochat.protocol.api.Persona;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcCheckpointStoreTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcCheckpointStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = H2TestDatabase.create();
        store = new JdbcCheckpointStore(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void getReturnsEmptyForUnknownThread() {
        assertThat(store.get("nobody")).isEmpty();
    }

    @Test
    void putThenGetRoundTripsMessagesAndSummary() {
        store.put("t1", new ConversationSnapshot(
                List.of(ChatMessage.user("hi"), ChatMessage.assistant("hello")), "greeted"));

        ConversationSnapshot loaded = store.get("t1").orElseThrow();

        assertThat(loaded.messages()).extracting(ChatMessage::role)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(loaded.messages().get(1).content()).isEqualTo("hello");
        assertThat(loaded.summary()).isEqualTo("greeted");
    }

    @Test
    void ownerPersonaIsStored() {
        store.put("staff", new ConversationSnapshot(Persona.INTERNAL, List.of(ChatMessage.user("stock?")), null));

        assertThat(store.get("staff").orElseThrow().persona()).isEqualTo(Persona.INTERNAL);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT persona FROM checkpoints WHERE thread_id = ?", String.class, "staff")).isEqualTo("INTERNAL");
    }

    @Test
    void rowsWithoutPersonaLoadUnowned() {
        jdbcTemplate.update("INSERT INTO checkpoints (thread_id, messages, summary) VALUES (?, ?, ?)",
                "legacy", "[]", "old");
        jdbcTemplate.update("INSERT INTO checkpoints (thread_id, persona, messages, summary) VALUES (?, ?, ?, ?)",
                "odd", "ROBOT", "[]", "odd");

        assertThat(store.get("legacy").orElseThrow().persona()).isNull();
        assertThat(store.get("odd").orElseThrow().persona()).isNull();
        assertThat(store.get("odd").orElseThrow().ownedBy(Persona.EXTERNAL)).isTrue();
    }

    @Test
    void lastWriteWinsWithSingleRowPerThread() {
        store.put("t1", new ConversationSnapshot(List.of(ChatMessage.user("one")), "first"));
        store.put("t1", new ConversationSnapshot(List.of(ChatMessage.user("two")), "second"));

        assertThat(store.get("t1").orElseThrow().summary()).isEqualTo("second");
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM checkpoints WHERE thread_id = ?", Integer.class, "t1");
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void threadsAreIsolated() {
        store.put("a", new ConversationSnapshot(List.of(ChatMessage.user("from a")), null));

        assertThat(store.get("b")).isEmpty();
        assertThat(store.get("a").orElseThrow().summary()).isNull();
    }

    @Test
    void corruptRowLoadsAsEmptyHistory() {
        jdbcTemplate.update("INSERT INTO checkpoints (thread_id, messages, summary) VALUES (?, ?, ?)",
                "broken", "not json", "kept");

        ConversationSnapshot loaded = store.get("broken").orElseThrow();

        assertThat(loaded.messages()).isEmpty();
        assertThat(loaded.summary()).isEqualTo("kept");
    }

    @Test
    void missingTableDegradesToEmptyInsteadOfThrowing() {
        jdbcTemplate.execute("DROP TABLE checkpoints");

        store.put("t1", ConversationSnapshot.empty());

        assertThat(store.get("t1")).isEmpty();
    }
}
