package com.defaultrisk.infrastructure.messaging;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the batch-jobs topic. Partitions bound the number of workers that can
 * hold jobs at the same time across all instances.
 */
@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic batchJobsTopic(
            @Value("${app.kafka.topics.batch-jobs}") String name,
            @Value("${app.kafka.topics.batch-jobs-partitions:6}") int partitions,
            @Value("${app.kafka.topics.replication-factor:1}") short replicationFactor) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }
}
