package io.github.drompincen.restochat.persistence.checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, ConversationSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationSnapshot> get(String threadId) {
        return Optional.ofNullable(snapshots.get(threadId));
    }

    @Override
    public void put(String threadId, ConversationSnapshot snapshot) {
        snapshots.put(threadId, snapshot);
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    @Override
    public void close() {
        snapshots.clear();
    }
}
