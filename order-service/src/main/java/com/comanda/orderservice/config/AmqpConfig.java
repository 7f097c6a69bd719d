// order-service/src/main/java/com/comanda/orderservice/config/AmqpConfig.java
package com.comanda.orderservice.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Broker topology owned by this service: the events exchange the outbox
 * publishes to, and the shared dead-letter exchange. Consumers declare and
 * bind their own queues.
 */
@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";

    public static final String EVENTS_EXCHANGE = "comanda_events_exchange";

    public static final String ROUTING_KEY_ORDER_CREATED = "order.created";
    public static final String ROUTING_KEY_ORDER_STATUS_CHANGED = "order.status_changed";
    public static final String ROUTING_KEY_ORDER_CANCELLED = "order.cancelled";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange comandaEventsExchange() {
        return new TopicExchange(EVENTS_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
