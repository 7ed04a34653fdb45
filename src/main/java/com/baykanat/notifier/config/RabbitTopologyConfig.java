package com.baykanat.notifier.config;

import com.baykanat.notifier.infrastructure.amqp.DelayTierRouter;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/** Ana kuyruk, DLQ, retry exchange ve her tier için ana kuyruğa dead-letter eden TTL'li delay kuyruğu. */
@Configuration
public class RabbitTopologyConfig {

    /** Tüm topoloji tek Declarables bean'i; açılışta RabbitAdmin declare eder. */
    @Bean
    public Declarables notificationTopology(AppProperties appProperties, DelayTierRouter tierRouter) {
        AppProperties.RabbitProperties rabbit = appProperties.getRabbit();
        List<Declarable> declarables = new ArrayList<>();

        declarables.add(QueueBuilder.durable(rabbit.getMainQueue()).build());
        declarables.add(QueueBuilder.durable(rabbit.getDeadLetterQueue()).build());

        TopicExchange retryExchange = new TopicExchange(rabbit.getRetryExchange(), true, false);
        declarables.add(retryExchange);

        for (long tier : tierRouter.tiers()) {
            // Default exchange ("") + ana kuyruk adı: süresi dolan mesaj ana kuyruğa döner
            Queue delayQueue = QueueBuilder.durable(DelayTierRouter.queueName(tier))
                    .deadLetterExchange("")
                    .deadLetterRoutingKey(rabbit.getMainQueue())
                    .ttl(Math.toIntExact(tier))
                    .build();
            Binding binding = BindingBuilder.bind(delayQueue)
                    .to(retryExchange)
                    .with(DelayTierRouter.routingKey(tier));
            declarables.add(delayQueue);
            declarables.add(binding);
        }
        return new Declarables(declarables);
    }

    /** Declare hataları log'lanıp yutulmaz, fırlatılır. */
    @Bean
    public RabbitAdmin rabbitAdmin(ConnectionFactory connectionFactory) {
        RabbitAdmin admin = new RabbitAdmin(connectionFactory);
        admin.setIgnoreDeclarationExceptions(false);
        return admin;
    }
}
