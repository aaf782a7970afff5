package com.acme.verify.persistence.jdbc.dlq;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.verify.domain.DeadLetter;
import com.acme.verify.persistence.jdbc.H2RepositoryTestBase;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for the H2 dead-letter repository.
 */
class H2DeadLetterRepositoryTest extends H2RepositoryTestBase {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private H2DeadLetterRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        repository = new H2DeadLetterRepository(dataSource);
        truncate("verification_dlq");
    }

    private static DeadLetter deadLetter(UUID id, String subject, Instant deadAt) {
        return new DeadLetter(id, subject, "join", "sig", 1, T0, deadAt, "visibility window expired");
    }

    @Test
    @DisplayName("insertIfAbsent stores all details of the request")
    void insertStoresDetails() {
        UUID id = UUID.randomUUID();

        assertThat(repository.insertIfAbsent(deadLetter(id, "u1", T0.plusSeconds(900)))).isTrue();

        DeadLetter stored = repository.findById(id).orElseThrow();
        assertThat(stored.getSubject()).isEqualTo("u1");
        assertThat(stored.getContext()).isEqualTo("join");
        assertThat(stored.getSignal()).isEqualTo("sig");
        assertThat(stored.getReceiveCount()).isEqualTo(1);
        assertThat(stored.getEnqueuedAt()).isEqualTo(T0);
        assertThat(stored.getDeadLetteredAt()).isEqualTo(T0.plusSeconds(900));
        assertThat(stored.getReason()).isEqualTo("visibility window expired");
        assertThat(stored.toRequest().subject()).isEqualTo("u1");
    }

    @Test
    @DisplayName("a second insert for the same message is ignored")
    void duplicateInsertIgnored() {
        UUID id = UUID.randomUUID();
        repository.insertIfAbsent(deadLetter(id, "u1", T0));

        assertThat(repository.insertIfAbsent(deadLetter(id, "changed", T0.plusSeconds(5)))).isFalse();

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findById(id).orElseThrow().getSubject()).isEqualTo("u1");
    }

    @Test
    @DisplayName("long reasons are truncated rather than rejected")
    void longReasonTruncated() {
        UUID id = UUID.randomUUID();
        DeadLetter letter = deadLetter(id, "u1", T0);
        letter.setReason("x".repeat(5000));

        repository.insertIfAbsent(letter);

        assertThat(repository.findById(id).orElseThrow().getReason()).hasSize(2000);
    }

    @Test
    @DisplayName("findRecent lists newest dead letters first")
    void findRecentNewestFirst() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID third = UUID.randomUUID();
        repository.insertIfAbsent(deadLetter(first, "a", T0));
        repository.insertIfAbsent(deadLetter(second, "b", T0.plusSeconds(10)));
        repository.insertIfAbsent(deadLetter(third, "c", T0.plusSeconds(20)));

        List<DeadLetter> recent = repository.findRecent(2);

        assertThat(recent).extracting(DeadLetter::getMessageId).containsExactly(third, second);
    }

    @Test
    @DisplayName("deleteOlderThan purges only entries past retention")
    void purgeByRetention() {
        Duration retention = Duration.ofDays(14);
        Instant now = T0.plus(Duration.ofDays(20));
        UUID old = UUID.randomUUID();
        UUID kept = UUID.randomUUID();
        repository.insertIfAbsent(deadLetter(old, "a", T0));
        repository.insertIfAbsent(deadLetter(kept, "b", T0.plus(Duration.ofDays(10))));

        int purged = repository.deleteOlderThan(now.minus(retention));

        assertThat(purged).isEqualTo(1);
        assertThat(repository.findById(old)).isEmpty();
        assertThat(repository.findById(kept)).isPresent();
    }

    @Test
    @DisplayName("delete removes a single entry")
    void deleteSingle() {
        UUID id = UUID.randomUUID();
        repository.insertIfAbsent(deadLetter(id, "a", T0));

        assertThat(repository.delete(id)).isTrue();
        assertThat(repository.delete(id)).isFalse();
        assertThat(repository.count()).isZero();
    }
}
