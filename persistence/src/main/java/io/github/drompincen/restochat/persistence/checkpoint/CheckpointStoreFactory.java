package io.github.drompincen.restochat.persistence.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.persistence.schema.SchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Opens the durable checkpoint store, or falls back to a process-lifetime map when the
 * embedded database cannot be opened.
 */
public final class CheckpointStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreFactory.class);

    private CheckpointStoreFactory() {}

    public static CheckpointStore open(SchemaInitializer schema, JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        if (schema.initialize()) {
            return new JdbcCheckpointStore(jdbcTemplate, objectMapper);
        }
        log.warn("Checkpoint database unavailable; conversation state will not survive a restart");
        return new InMemoryCheckpointStore();
    }
}
