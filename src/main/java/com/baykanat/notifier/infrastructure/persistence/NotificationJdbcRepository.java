package com.baykanat.notifier.infrastructure.persistence;

import com.baykanat.notifier.domain.model.NotificationRecord;
import com.baykanat.notifier.domain.model.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** notifications tablosu üzerinde idempotency ledger; event_id unique. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class NotificationJdbcRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final String INSERT_SQL = """
            INSERT INTO notifications (id, event_id, event_type, payload, status, attempt_count)
            VALUES (?, ?, ?, ?::jsonb, 'QUEUED', 0)
            ON CONFLICT (event_id) DO NOTHING
            """;

    private static final String UPDATE_STATUS_SQL = """
            UPDATE notifications
            SET status = ?, last_attempt_timestamp = ?, attempt_count = attempt_count + 1
            WHERE event_id = ?
            """;

    private static final RowMapper<NotificationRecord> ROW_MAPPER = (rs, rowNum) -> NotificationRecord.builder()
            .id(rs.getString("id"))
            .eventId(rs.getString("event_id"))
            .eventType(rs.getString("event_type"))
            .payload(rs.getString("payload"))
            .status(NotificationStatus.valueOf(rs.getString("status")))
            .attemptCount(rs.getInt("attempt_count"))
            .lastAttemptTimestamp(toInstant(rs.getTimestamp("last_attempt_timestamp")))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .build();

    /** Sadece SENT veya FAILED_DLQ için true; QUEUED ve FAILED_RETRYING hâlâ işlenmeli. */
    public boolean isHandled(String eventId) {
        String sql = "SELECT status FROM notifications WHERE event_id = ?";
        List<String> statuses = jdbcTemplate.queryForList(sql, String.class, eventId);
        return !statuses.isEmpty() && NotificationStatus.valueOf(statuses.get(0)).isTerminal();
    }

    /** QUEUED satır ekler; ON CONFLICT DO NOTHING ile tekrar eden event_id atlanır. Satır eklendi mi döner. */
    public boolean createIfAbsent(NotificationRecord record) {
        int inserted = jdbcTemplate.update(INSERT_SQL,
                record.getId(),
                record.getEventId(),
                record.getEventType(),
                record.getPayload());
        if (inserted == 0) {
            log.debug("Ledger record for event {} already exists", record.getEventId());
        }
        return inserted > 0;
    }

    /** Status'u yazar, deneme zamanını damgalar, attempt_count'u artırır; geçiş kontrolü yok. */
    public void updateStatus(String eventId, NotificationStatus status) {
        int updated = jdbcTemplate.update(UPDATE_STATUS_SQL,
                status.name(), Timestamp.from(Instant.now(clock)), eventId);
        if (updated == 0) {
            log.warn("Status update to {} matched no ledger record for event {}", status, eventId);
        }
    }

    public Optional<NotificationRecord> findByEventId(String eventId) {
        String sql = "SELECT * FROM notifications WHERE event_id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, eventId).stream().findFirst();
    }

    /**
     * Belirtilen günden eski SENT kayıtların payload'ını siler; satır ve status kalır, böylece
     * aynı event_id ile gelen redelivery veya tekrar gönderim hâlâ isHandled ile atlanır.
     * Temizlenen kayıt sayısını döner.
     */
    public int purgeSentPayloadsOlderThan(int retentionDays) {
        String sql = "UPDATE notifications SET payload = NULL "
                + "WHERE status = 'SENT' AND payload IS NOT NULL "
                + "AND last_attempt_timestamp < NOW() - INTERVAL '1 day' * ?";
        return jdbcTemplate.update(sql, retentionDays);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
