package com.baykanat.notifier.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI notificationRelayOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Notification Relay - Event Ingestion & Delivery Status API")
                        .description("""
                                Accepts application events over HTTP, queues them on RabbitMQ and \
                                delivers a notification per event with at-least-once semantics, \
                                tiered retries and a dead letter queue.\
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
