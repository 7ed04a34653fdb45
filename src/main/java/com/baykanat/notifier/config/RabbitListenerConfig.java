package com.baykanat.notifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Listener container: manuel ack, sınırlı prefetch; açılış kontrolleri geçince başlatılır. */
@Configuration
public class RabbitListenerConfig {

    /** Tüm publish'ler JSON; auto-configured RabbitTemplate bu bean'i kullanır. */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            AppProperties appProperties) {
        AppProperties.RabbitProperties rabbit = appProperties.getRabbit();
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);

        // Ack/nack consumer'da; örtük requeue yok
        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setDefaultRequeueRejected(false);
        factory.setPrefetchCount(rabbit.getPrefetch());
        factory.setConcurrentConsumers(rabbit.getConcurrency());
        factory.setMaxConcurrentConsumers(Math.max(rabbit.getConcurrency(), rabbit.getMaxConcurrency()));
        // Topoloji declare edildikten sonra StartupConnectivityRunner başlatır
        factory.setAutoStartup(false);
        return factory;
    }
}
