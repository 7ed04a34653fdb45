package com.baykanat.notifier.infrastructure.persistence;

import com.baykanat.notifier.config.ClockConfig;
import com.baykanat.notifier.domain.model.NotificationRecord;
import com.baykanat.notifier.domain.model.NotificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ledger queries against a real PostgreSQL (JSONB column, ON CONFLICT on event_id).
 * Not transactional, so concurrent inserts see each other's commits.
 */
@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers
@Import({NotificationJdbcRepository.class, ClockConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class NotificationJdbcRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("notifications_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private NotificationJdbcRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTable() {
        jdbcTemplate.update("DELETE FROM notifications");
    }

    private static NotificationRecord record(String eventId) {
        return NotificationRecord.builder()
                .id("notif-" + eventId)
                .eventId(eventId)
                .eventType("user_registered")
                .payload("{\"email\":\"jane@example.com\",\"username\":\"jane\"}")
                .status(NotificationStatus.QUEUED)
                .build();
    }

    @Test
    @DisplayName("Unknown event is not handled")
    void unknownEventNotHandled() {
        assertThat(repository.isHandled("missing")).isFalse();
        assertThat(repository.findByEventId("missing")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({"QUEUED, false", "FAILED_RETRYING, false", "SENT, true", "FAILED_DLQ, true"})
    @DisplayName("Only terminal statuses count as handled")
    void handledOnlyWhenTerminal(NotificationStatus status, boolean handled) {
        repository.createIfAbsent(record("evt-1"));
        if (status != NotificationStatus.QUEUED) {
            repository.updateStatus("evt-1", status);
        }

        assertThat(repository.isHandled("evt-1")).isEqualTo(handled);
    }

    @Test
    @DisplayName("Create inserts a QUEUED row with the payload as JSONB")
    void createInsertsQueuedRow() {
        assertThat(repository.createIfAbsent(record("evt-1"))).isTrue();

        NotificationRecord stored = repository.findByEventId("evt-1").orElseThrow();
        assertThat(stored.getId()).isEqualTo("notif-evt-1");
        assertThat(stored.getStatus()).isEqualTo(NotificationStatus.QUEUED);
        assertThat(stored.getAttemptCount()).isZero();
        assertThat(stored.getLastAttemptTimestamp()).isNull();
        assertThat(stored.getCreatedAt()).isNotNull();

        String email = jdbcTemplate.queryForObject(
                "SELECT payload->>'email' FROM notifications WHERE event_id = ?", String.class, "evt-1");
        assertThat(email).isEqualTo("jane@example.com");
    }

    @Test
    @DisplayName("Duplicate create is a no-op and keeps the existing status")
    void duplicateCreateIsNoOp() {
        repository.createIfAbsent(record("evt-1"));
        repository.updateStatus("evt-1", NotificationStatus.FAILED_RETRYING);

        assertThat(repository.createIfAbsent(record("evt-1"))).isFalse();

        NotificationRecord stored = repository.findByEventId("evt-1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(NotificationStatus.FAILED_RETRYING);
        assertThat(stored.getAttemptCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Each status update increments attempt_count and stamps the attempt time")
    void updateStatusIncrementsAttempts() {
        repository.createIfAbsent(record("evt-1"));

        repository.updateStatus("evt-1", NotificationStatus.FAILED_RETRYING);
        repository.updateStatus("evt-1", NotificationStatus.FAILED_RETRYING);
        repository.updateStatus("evt-1", NotificationStatus.SENT);

        NotificationRecord stored = repository.findByEventId("evt-1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(stored.getAttemptCount()).isEqualTo(3);
        assertThat(stored.getLastAttemptTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Update for an unknown event changes nothing")
    void updateUnknownEvent() {
        repository.updateStatus("missing", NotificationStatus.SENT);

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM notifications", Integer.class);
        assertThat(count).isZero();
    }

    @Test
    @DisplayName("Retention clears the payload of old SENT rows but keeps them handled")
    void purgeSentPayloadsOlderThan() {
        for (String eventId : List.of("old-sent", "new-sent", "old-dlq")) {
            repository.createIfAbsent(record(eventId));
        }
        repository.updateStatus("old-sent", NotificationStatus.SENT);
        repository.updateStatus("new-sent", NotificationStatus.SENT);
        repository.updateStatus("old-dlq", NotificationStatus.FAILED_DLQ);
        jdbcTemplate.update("UPDATE notifications SET last_attempt_timestamp = NOW() - INTERVAL '40 days' "
                + "WHERE event_id IN ('old-sent', 'old-dlq')");

        int purged = repository.purgeSentPayloadsOlderThan(30);

        assertThat(purged).isEqualTo(1);
        NotificationRecord oldSent = repository.findByEventId("old-sent").orElseThrow();
        assertThat(oldSent.getPayload()).isNull();
        assertThat(oldSent.getStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(repository.isHandled("old-sent")).isTrue();
        assertThat(repository.findByEventId("new-sent").orElseThrow().getPayload()).isNotNull();
        assertThat(repository.findByEventId("old-dlq").orElseThrow().getPayload()).isNotNull();

        // resubmission of the purged id is still a no-op for the ledger
        assertThat(repository.createIfAbsent(record("old-sent"))).isFalse();
        assertThat(repository.purgeSentPayloadsOlderThan(30)).isZero();
    }

    @Test
    @DisplayName("Concurrent creates for the same event yield exactly one row")
    void concurrentCreateYieldsOneRow() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> create = () -> {
                    start.await();
                    return repository.createIfAbsent(record("evt-race"));
                };
                results.add(executor.submit(create));
            }
            start.countDown();

            int inserted = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    inserted++;
                }
            }

            assertThat(inserted).isEqualTo(1);
            Integer rows = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM notifications WHERE event_id = 'evt-race'", Integer.class);
            assertThat(rows).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
