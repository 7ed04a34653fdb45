package com.baykanat.notifier.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Broker mesaj gövdesi. id ingestion'da bir kez atanır, tüm retry'larda aynı kalır. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationEvent {

    private String id;
    private String eventType;
    private String timestamp; // ISO-8601
    private Map<String, Object> payload;
    private int retryCount;

    /** Sonraki retry için kopya; tüketilen mesajın kendisi değişmez. */
    public NotificationEvent withNextRetry() {
        return toBuilder().retryCount(retryCount + 1).build();
    }
}
