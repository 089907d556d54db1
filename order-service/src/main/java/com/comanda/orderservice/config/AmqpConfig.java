package com.comanda.orderservice.config;

import com.comanda.common.contracts.DishEventContract;
import com.comanda.common.contracts.RestaurantEventContract;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.DefaultJackson2JavaTypeMapper;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String NOTIFICATION_EXCHANGE = "notification_events_exchange";
    public static final String CATALOG_EXCHANGE = "catalog_events_exchange";

    public static final String Q_CATALOG_UPDATES = "q.order.catalog.updates";

    public static final String ROUTING_KEY_DISH_ALL = "dish.#";
    public static final String ROUTING_KEY_RESTAURANT_ALL = "restaurant.#";

    // __TypeId__ values the catalog service stamps on its messages
    public static final String TYPE_DISH = "dish";
    public static final String TYPE_RESTAURANT = "restaurant";

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
    public TopicExchange notificationEventsExchange() {
        return new TopicExchange(NOTIFICATION_EXCHANGE);
    }

    @Bean
    public TopicExchange catalogEventsExchange() {
        return new TopicExchange(CATALOG_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        Jackson2JsonMessageConverter converter = new Jackson2JsonMessageConverter(objectMapper);

        DefaultJackson2JavaTypeMapper typeMapper = new DefaultJackson2JavaTypeMapper();
        typeMapper.setTrustedPackages("com.comanda.common.contracts");
        typeMapper.setIdClassMapping(Map.of(
                TYPE_DISH, DishEventContract.class,
                TYPE_RESTAURANT, RestaurantEventContract.class));
        converter.setJavaTypeMapper(typeMapper);

        return converter;
    }

    // Producer only for notifications: the notification service owns its queues

    @Bean
    public Queue catalogUpdateQueue() {
        return createDurableQueue(Q_CATALOG_UPDATES);
    }

    @Bean
    public Binding dishUpdateBinding(Queue catalogUpdateQueue, TopicExchange catalogEventsExchange) {
        return BindingBuilder.bind(catalogUpdateQueue).to(catalogEventsExchange).with(ROUTING_KEY_DISH_ALL);
    }

    @Bean
    public Binding restaurantUpdateBinding(Queue catalogUpdateQueue, TopicExchange catalogEventsExchange) {
        return BindingBuilder.bind(catalogUpdateQueue).to(catalogEventsExchange).with(ROUTING_KEY_RESTAURANT_ALL);
    }

    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
