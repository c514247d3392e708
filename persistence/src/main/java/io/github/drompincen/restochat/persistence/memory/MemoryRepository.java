package io.github.drompincen.restochat.persistence.memory;

import io.github.drompincen.restochat.protocol.api.MemorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-thread fact ledger. Every query is filtered by {@code thread_id}; there is no
 * cross-thread read. Database errors are logged and turned into empty results.
 */
public class MemoryRepository {

    private static final Logger log = LoggerFactory.getLogger(MemoryRepository.class);

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int DEFAULT_SEARCH_LIMIT = 5;

    private static final String COLUMNS = "id, thread_id, content, tags, importance, source, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public MemoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> add(String threadId, String content, List<String> tags, int importance, MemorySource source) {
        if (content == null || content.isBlank()) return Optional.empty();
        String id = UUID.randomUUID().toString();
        Timestamp now = Timestamp.from(Instant.now());
        try {
            jdbcTemplate.update(
                    "INSERT INTO memories (id, thread_id, content, tags, importance, source, created_at, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    id, threadId, content.trim(), joinTags(tags), clampImportance(importance),
                    source.name(), now, now);
            log.debug("Stored memory {} for thread {}: {}", id, threadId, content);
            return Optional.of(id);
        } catch (DataAccessException e) {
            log.error("Failed to store memory for thread {}: {}", threadId, e.getMessage());
            return Optional.empty();
        }
    }

    public List<MemoryRecord> list(String threadId, int limit) {
        return query("SELECT " + COLUMNS + " FROM memories WHERE thread_id = ? "
                + "ORDER BY updated_at DESC, seq DESC LIMIT ?", threadId, positive(limit, DEFAULT_LIST_LIMIT));
    }

    /** Case-insensitive substring match on content, newest first. */
    public List<MemoryRecord> search(String threadId, String query, int limit) {
        if (query == null || query.isBlank()) return list(threadId, positive(limit, DEFAULT_SEARCH_LIMIT));
        String pattern = "%" + escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        return query("SELECT " + COLUMNS + " FROM memories WHERE thread_id = ? "
                        + "AND LOWER(content) LIKE ? ESCAPE '\\' ORDER BY updated_at DESC, seq DESC LIMIT ?",
                threadId, pattern, positive(limit, DEFAULT_SEARCH_LIMIT));
    }

    /** Records whose content starts with {@code key:}, newest first. */
    public List<MemoryRecord> findByKey(String threadId, String key, int limit) {
        String pattern = escapeLike(key.toLowerCase(Locale.ROOT)) + ":%";
        return query("SELECT " + COLUMNS + " FROM memories WHERE thread_id = ? "
                        + "AND LOWER(content) LIKE ? ESCAPE '\\' ORDER BY updated_at DESC, seq DESC LIMIT ?",
                threadId, pattern, positive(limit, DEFAULT_LIST_LIMIT));
    }

    public boolean delete(String threadId, String id) {
        try {
            return jdbcTemplate.update("DELETE FROM memories WHERE id = ? AND thread_id = ?", id, threadId) > 0;
        } catch (DataAccessException e) {
            log.error("Failed to delete memory {} for thread {}: {}", id, threadId, e.getMessage());
            return false;
        }
    }

    private List<MemoryRecord> query(String sql, Object... args) {
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, args);
        } catch (DataAccessException e) {
            log.error("Memory query failed: {}", e.getMessage());
            return List.of();
        }
    }

    static int clampImportance(int importance) {
        return Math.max(1, Math.min(5, importance));
    }

    private static int positive(int limit, int fallback) {
        return limit > 0 ? limit : fallback;
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String joinTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) return "";
        return tags.stream().map(String::trim).filter(t -> !t.isEmpty()).distinct()
                .collect(Collectors.joining(","));
    }

    private static List<String> splitTags(String tags) {
        if (tags == null || tags.isBlank()) return List.of();
        return Arrays.stream(tags.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
    }

    private static final RowMapper<MemoryRecord> ROW_MAPPER = (rs, rowNum) -> new MemoryRecord(
            rs.getString("id"),
            rs.getString("thread_id"),
            rs.getString("content"),
            splitTags(rs.getString("tags")),
            rs.getInt("importance"),
            MemorySource.valueOf(rs.getString("source")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant());
}
