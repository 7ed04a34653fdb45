package com.baykanat.notifier.infrastructure.amqp;

import com.baykanat.notifier.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/** Gecikmeleri delay tier'lara eşler: kuyruk adları, routing key'ler, retry başına tier artışı. */
@Component
public class DelayTierRouter {

    private static final String ROUTING_KEY_PREFIX = "retry.";

    private final List<Long> tiers;

    public DelayTierRouter(AppProperties appProperties) {
        List<Long> configured = appProperties.getRabbit().getDelayTiersMs();
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("app.rabbit.delay-tiers-ms must contain at least one tier");
        }
        if (configured.stream().anyMatch(tier -> tier == null || tier <= 0)) {
            throw new IllegalStateException("app.rabbit.delay-tiers-ms must be positive: " + configured);
        }
        this.tiers = configured.stream().distinct().sorted().toList();
    }

    public List<Long> tiers() {
        return tiers;
    }

    /** İstenen gecikmeden büyük/eşit en küçük tier; hepsinden büyükse en büyük tier. */
    public long selectTier(long delayMs) {
        for (long tier : tiers) {
            if (tier >= delayMs) {
                return tier;
            }
        }
        return tiers.get(tiers.size() - 1);
    }

    /** n. retry (1'den başlar) n. tier'ı kullanır; sonrasında en uzun tier'da kalır. */
    public long delayForRetry(int retryNumber) {
        int index = Math.min(Math.max(retryNumber, 1), tiers.size()) - 1;
        return tiers.get(index);
    }

    public String routingKeyFor(long delayMs) {
        return routingKey(selectTier(delayMs));
    }

    public static String routingKey(long tierMs) {
        return ROUTING_KEY_PREFIX + tierMs;
    }

    /** Tam saniyede delay_queue_5s, değilse delay_queue_1500ms. */
    public static String queueName(long tierMs) {
        return tierMs % 1000 == 0
                ? "delay_queue_" + (tierMs / 1000) + "s"
                : "delay_queue_" + tierMs + "ms";
    }
}
