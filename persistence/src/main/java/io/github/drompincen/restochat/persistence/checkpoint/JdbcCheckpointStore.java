package io.github.drompincen.restochat.persistence.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.Persona;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint table with one row per thread. Messages are stored as a JSON array so the
 * row can be replaced in a single MERGE.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);
    private static final TypeReference<List<ChatMessage>> MESSAGE_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ConversationSnapshot> get(String threadId) {
        try {
            ConversationSnapshot snapshot = jdbcTemplate.queryForObject(
                    "SELECT persona, messages, summary FROM checkpoints WHERE thread_id = ?",
                    (rs, rowNum) -> new ConversationSnapshot(
                            readPersona(threadId, rs.getString("persona")),
                            readMessages(threadId, rs.getString("messages")),
                            rs.getString("summary")),
                    threadId);
            return Optional.ofNullable(snapshot);
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("Failed to load checkpoint for thread {}: {}", threadId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String threadId, ConversationSnapshot snapshot) {
        try {
            String json = objectMapper.writeValueAsString(snapshot.messages());
            jdbcTemplate.update("""
                    MERGE INTO checkpoints (thread_id, persona, messages, summary, updated_at)
                    KEY (thread_id)
                    VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)
                    """, threadId, snapshot.persona() != null ? snapshot.persona().name() : null,
                    json, snapshot.summary());
            log.debug("Saved checkpoint for thread {} ({} messages)", threadId, snapshot.messages().size());
        } catch (Exception e) {
            log.error("Failed to save checkpoint for thread {}", threadId, e);
        }
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    private static Persona readPersona(String threadId, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Persona.valueOf(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown persona '{}' on checkpoint of thread {}", value, threadId);
            return null;
        }
    }

    private List<ChatMessage> readMessages(String threadId, String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, MESSAGE_LIST);
        } catch (Exception e) {
            log.error("Unreadable checkpoint messages for thread {}, starting fresh", threadId, e);
            return List.of();
        }
    }
}
