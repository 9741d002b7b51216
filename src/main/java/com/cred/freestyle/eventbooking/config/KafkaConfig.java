package com.cred.freestyle.eventbooking.config;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for booking lifecycle events (reserved, confirmed, cancelled, expired).
 *
 * This service only produces. The template's default topic is the lifecycle topic, and
 * records are keyed by event id by the publisher.
 *
 * @author Event Booking Team
 */
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.application.name:event-booking-service}")
    private String clientId;

    @Value("${eventbooking.kafka.lifecycle-topic:event-booking-lifecycle}")
    private String lifecycleTopic;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private Integer retries;

    @Value("${spring.kafka.producer.linger-ms:10}")
    private Integer lingerMs;

    /**
     * Publishing runs on the request thread after commit; send() must not block it for long
     * when the cluster is unreachable.
     */
    @Value("${spring.kafka.producer.max-block-ms:5000}")
    private Long maxBlockMs;

    @Bean
    public ProducerFactory<String, String> lifecycleProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId + "-lifecycle");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Idempotent producer keeps per-event ordering across retries
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, acks);
        props.put(ProducerConfig.RETRIES_CONFIG, retries);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.LINGER_MS_CONFIG, lingerMs);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> lifecycleKafkaTemplate(ProducerFactory<String, String> lifecycleProducerFactory) {
        KafkaTemplate<String, String> template = new KafkaTemplate<>(lifecycleProducerFactory);
        template.setDefaultTopic(lifecycleTopic);
        return template;
    }
}
