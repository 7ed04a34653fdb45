package com.baykanat.notifier.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** app.* için tip güvenli configuration (topoloji adları ve tier'lar, gönderim politikası, açılış retry, retention). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private RabbitProperties rabbit = new RabbitProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private StartupProperties startup = new StartupProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class RabbitProperties {
        private String mainQueue = "notification_events";
        private String deadLetterQueue = "notification_dead_letter_queue";
        private String retryExchange = "retry_exchange";
        /** Delay tier TTL'leri (ms); her değer için bir durable delay kuyruğu. */
        private List<Long> delayTiersMs = new ArrayList<>(List.of(1000L, 5000L, 30000L));
        /** Consumer başına ack'lenmemiş mesaj sayısı. */
        private int prefetch = 1;
        private int concurrency = 1;
        private int maxConcurrency = 1;
        private Duration confirmTimeout = Duration.ofSeconds(5);
        /** Geçici hata sonrası nack(requeue) öncesi bekleme. */
        private Duration requeueDelay = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class DeliveryProperties {
        private int maxRetries = 3;
        private Duration simulatedLatency = Duration.ofMillis(100);
        /** Bu marker'ı içeren alıcılar simülasyonda başarısız olur. */
        private String failureMarker = "fail";
    }

    @Getter
    @Setter
    public static class StartupProperties {
        private int maxAttempts = 10;
        private Duration waitDuration = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private long ledgerCleanupRate = 3600000;
        /** Bu süreden eski SENT kayıtların payload'ı temizlenir; satırlar kalır. */
        private int ledgerRetentionDays = 30;
    }
}
