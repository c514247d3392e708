package io.github.drompincen.restochat.persistence.checkpoint;

import java.util.Optional;

/**
 * One snapshot per thread, last write wins. Implementations never throw on I/O trouble:
 * a failed read looks like a new thread and a failed write is dropped.
 */
public interface CheckpointStore extends AutoCloseable {

    Optional<ConversationSnapshot> get(String threadId);

    void put(String threadId, ConversationSnapshot snapshot);

    boolean isDurable();

    @Override
    default void close() {}
}
