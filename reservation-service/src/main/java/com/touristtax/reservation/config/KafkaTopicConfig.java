package com.touristtax.reservation.config;

import com.touristtax.reservation.events.LifecycleEventPublisher;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic reservationCreatedTopic() {
        return TopicBuilder.name(LifecycleEventPublisher.TOPIC_RESERVATION_CREATED).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic reservationStatusChangedTopic() {
        return TopicBuilder.name(LifecycleEventPublisher.TOPIC_RESERVATION_STATUS_CHANGED).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic paymentStatusChangedTopic() {
        return TopicBuilder.name(LifecycleEventPublisher.TOPIC_PAYMENT_STATUS_CHANGED).partitions(3).replicas(1).build();
    }
}
