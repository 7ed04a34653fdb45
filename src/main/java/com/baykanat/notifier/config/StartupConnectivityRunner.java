package com.baykanat.notifier.config;

import com.baykanat.notifier.infrastructure.amqp.TopologyMismatchException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistry;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Açılışta PostgreSQL'i kontrol eder ve RabbitMQ topolojisini sınırlı retry ile declare eder,
 * ardından listener container'ları başlatır. Burada hata olursa uygulama non-zero exit ile kapanır.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class StartupConnectivityRunner implements ApplicationRunner {

    private final JdbcTemplate jdbcTemplate;
    private final RabbitAdmin rabbitAdmin;
    private final RabbitListenerEndpointRegistry listenerRegistry;
    private final AppProperties appProperties;

    @Override
    public void run(ApplicationArguments args) {
        AppProperties.StartupProperties startup = appProperties.getStartup();
        Retry retry = Retry.of("startupConnectivity", RetryConfig.custom()
                .maxAttempts(startup.getMaxAttempts())
                .waitDuration(startup.getWaitDuration())
                .ignoreExceptions(TopologyMismatchException.class)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("Startup attempt {}/{} failed: {}",
                event.getNumberOfRetryAttempts(), startup.getMaxAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        try {
            Retry.decorateRunnable(retry, this::checkConnectivity).run();
        } catch (TopologyMismatchException e) {
            log.error("Fatal topology mismatch: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Broker/database unreachable after " + startup.getMaxAttempts() + " attempts", e);
        }

        for (MessageListenerContainer container : listenerRegistry.getListenerContainers()) {
            container.start();
        }
        log.info("Startup checks passed; {} listener container(s) started",
                listenerRegistry.getListenerContainers().size());
    }

    void checkConnectivity() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        try {
            rabbitAdmin.initialize();
        } catch (AmqpException e) {
            if (isTopologyMismatch(e)) {
                throw new TopologyMismatchException(
                        "Declared queue/exchange arguments do not match the existing broker entities", e);
            }
            throw e;
        }
    }

    /** Cause zincirinde PRECONDITION_FAILED channel close var mı. */
    static boolean isTopologyMismatch(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof ShutdownSignalException signal
                    && signal.getReason() instanceof AMQP.Channel.Close close
                    && close.getReplyCode() == AMQP.PRECONDITION_FAILED) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
