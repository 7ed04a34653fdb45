package com.baykanat.notifier.scheduler;

import com.baykanat.notifier.config.AppProperties;
import com.baykanat.notifier.infrastructure.persistence.NotificationJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Retention süresini (varsayılan 30 gün) geçen SENT kayıtların payload'ını periyodik olarak temizler. */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerCleanupScheduler {

    private final NotificationJdbcRepository ledger;
    private final AppProperties appProperties;

    @Scheduled(
            fixedRateString = "${app.scheduler.ledger-cleanup-rate:3600000}",
            initialDelayString = "60000"
    )
    public void purgeSentPayloads() {
        try {
            int retentionDays = appProperties.getScheduler().getLedgerRetentionDays();
            int purged = ledger.purgeSentPayloadsOlderThan(retentionDays);
            if (purged > 0) {
                log.info("Ledger cleanup: purged payload of {} SENT rows older than {} days", purged, retentionDays);
            } else {
                log.debug("Ledger cleanup: no SENT payloads older than {} days", retentionDays);
            }
        } catch (Exception e) {
            log.error("Failed to clean up ledger: {}", e.getMessage(), e);
        }
    }
}
