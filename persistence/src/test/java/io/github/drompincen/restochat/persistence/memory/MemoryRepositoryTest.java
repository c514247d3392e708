package io.github.drompincen.restochat.persistence.memory;

import io.github.drompincen.restochat.persistence.H2TestDatabase;
import io.github.drompincen.restochat.protocol.api.MemorySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryRepositoryTest {

    private MemoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new MemoryRepository(H2TestDatabase.create());
    }

    @Test
    void addAndListNewestFirst() {
        repository.add("t1", "user_name:Ana", List.of("profile"), 3, MemorySource.USER);
        repository.add("t1", "preference:spicy food", List.of(), 1, MemorySource.USER);

        List<MemoryRecord> records = repository.list("t1", 10);

        assertThat(records).extracting(MemoryRecord::content)
                .containsExactly("preference:spicy food", "user_name:Ana");
        assertThat(records.get(1).tags()).containsExactly("profile");
        assertThat(records.get(1).source()).isEqualTo(MemorySource.USER);
    }

    @Test
    void importanceIsClamped() {
        repository.add("t1", "note:x", List.of(), 9, MemorySource.TOOL);
        repository.add("t1", "note:y", List.of(), -2, MemorySource.TOOL);

        assertThat(repository.list("t1", 10)).extracting(MemoryRecord::importance)
                .containsExactlyInAnyOrder(5, 1);
    }

    @Test
    void searchIsCaseInsensitiveSubstring() {
        repository.add("t1", "allergy:Peanuts", List.of(), 5, MemorySource.USER);
        repository.add("t1", "dislike:olives", List.of(), 2, MemorySource.USER);

        assertThat(repository.search("t1", "PEANUT", 5)).extracting(MemoryRecord::value)
                .containsExactly("Peanuts");
        assertThat(repository.search("t1", "100%", 5)).isEmpty();
    }

    @Test
    void noCrossThreadLeakage() {
        repository.add("t1", "user_name:Ana", List.of(), 3, MemorySource.USER);

        assertThat(repository.list("t2", 10)).isEmpty();
        assertThat(repository.search("t2", "ana", 5)).isEmpty();
        assertThat(repository.findByKey("t2", "user_name", 5)).isEmpty();
    }

    @Test
    void findByKeyMatchesPrefixOnly() {
        repository.add("t1", "user_name:Ana", List.of(), 3, MemorySource.USER);
        repository.add("t1", "note:user_name:looks odd", List.of(), 1, MemorySource.USER);

        assertThat(repository.findByKey("t1", "user_name", 5)).extracting(MemoryRecord::value)
                .containsExactly("Ana");
    }

    @Test
    void deleteRequiresMatchingThread() {
        String id = repository.add("t1", "note:keep", List.of(), 1, MemorySource.USER).orElseThrow();

        assertThat(repository.delete("t2", id)).isFalse();
        assertThat(repository.delete("t1", id)).isTrue();
        assertThat(repository.list("t1", 10)).isEmpty();
    }

    @Test
    void blankContentIsNotStored() {
        assertThat(repository.add("t1", "  ", List.of(), 1, MemorySource.USER)).isEmpty();
    }

    @Test
    void keyAndValueSplitOnFirstColon() {
        MemoryRecord record = new MemoryRecord("id", "t", "note: meet at 10:30", null, 1,
                MemorySource.USER, null, null);

        assertThat(record.key()).isEqualTo("note");
        assertThat(record.value()).isEqualTo("meet at 10:30");
        assertThat(record.tags()).isEmpty();
    }
}
