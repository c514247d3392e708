package io.github.drompincen.restochat.runtime.memory;

import io.github.drompincen.restochat.persistence.memory.MemoryRecord;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.protocol.api.MemorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns utterances into memory records and memory records into the short profile note the
 * responder sees.
 */
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    static final int NOTE_SOURCE_LIMIT = 50;
    static final int VALUES_PER_LINE = 5;

    private static final Map<String, String> NOTE_LABELS = new LinkedHashMap<>();

    static {
        NOTE_LABELS.put(FactExtractor.PREFERENCE, "Preferences");
        NOTE_LABELS.put(FactExtractor.DISLIKE, "Dislikes");
        NOTE_LABELS.put(FactExtractor.DIETARY, "Dietary");
        NOTE_LABELS.put(FactExtractor.ALLERGY, "Allergies");
        NOTE_LABELS.put(FactExtractor.NOTE, "Notes");
    }

    private final MemoryRepository repository;
    private final FactExtractor extractor;

    public MemoryService(MemoryRepository repository, FactExtractor extractor) {
        this.repository = repository;
        this.extractor = extractor;
    }

    /**
     * Extracts at most one fact from {@code text} and stores it. A name equal to the known
     * name (ignoring case) is not stored again.
     */
    public Optional<ExtractedFact> capture(String threadId, String text, MemorySource source) {
        String knownName = knownName(threadId).orElse(null);
        Optional<ExtractedFact> fact = extractor.extract(text, knownName);
        if (fact.isEmpty()) return Optional.empty();
        ExtractedFact f = fact.get();
        if (FactExtractor.USER_NAME.equals(f.key()) && f.value().equalsIgnoreCase(knownName)) {
            return Optional.empty();
        }
        repository.add(threadId, f.content(), List.of(f.key()), f.importance(), source);
        log.info("Captured {} fact for thread {} from {}", f.key(), threadId, source);
        return fact;
    }

    public Optional<String> knownName(String threadId) {
        return repository.findByKey(threadId, FactExtractor.USER_NAME, 1).stream()
                .findFirst()
                .map(MemoryRecord::value);
    }

    /**
     * Profile note for the responder, e.g. {@code Name: Sam} followed by one line per
     * category. Empty when the thread has no records.
     */
    public Optional<String> buildNote(String threadId) {
        List<MemoryRecord> records = repository.list(threadId, NOTE_SOURCE_LIMIT);
        if (records.isEmpty()) return Optional.empty();

        String name = null;
        Map<String, Set<String>> byLabel = new LinkedHashMap<>();
        NOTE_LABELS.values().forEach(label -> byLabel.put(label, new LinkedHashSet<>()));

        // newest first, so the first name seen is the current one
        for (MemoryRecord record : records) {
            String key = record.key().toLowerCase(Locale.ROOT);
            if (FactExtractor.USER_NAME.equals(key)) {
                if (name == null) name = record.value();
                continue;
            }
            String label = NOTE_LABELS.getOrDefault(key, "Notes");
            String value = NOTE_LABELS.containsKey(key) ? record.value() : record.content();
            Set<String> values = byLabel.get(label);
            if (values.size() < VALUES_PER_LINE && values.stream().noneMatch(v -> v.equalsIgnoreCase(value))) {
                values.add(value);
            }
        }

        List<String> lines = new ArrayList<>();
        if (name != null) lines.add("Name: " + name);
        byLabel.forEach((label, values) -> {
            if (!values.isEmpty()) lines.add(label + ": " + String.join(", ", values));
        });
        return lines.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", lines));
    }
}
