package com.defaultrisk.infrastructure.health;

import com.defaultrisk.domain.service.BatchJobService;
import com.defaultrisk.infrastructure.messaging.BatchJobWorker;
import com.defaultrisk.infrastructure.messaging.WorkerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.AbstractMessageListenerContainer;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Snapshots the worker pool of this instance from the Kafka listener containers and
 * the {@link WorkerRegistry}. Read-only; has no effect on job processing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerDiagnosticsService {

    private final KafkaListenerEndpointRegistry listenerRegistry;
    private final WorkerRegistry workerRegistry;
    private final BatchJobService jobService;

    public List<WorkerSnapshot> workers() {
        MessageListenerContainer container = listenerRegistry.getListenerContainer(BatchJobWorker.LISTENER_ID);
        if (container == null) {
            return List.of();
        }

        List<MessageListenerContainer> members = new ArrayList<>();
        if (container instanceof ConcurrentMessageListenerContainer) {
            members.addAll(((ConcurrentMessageListenerContainer<?, ?>) container).getContainers());
        } else {
            members.add(container);
        }

        List<WorkerSnapshot> snapshots = new ArrayList<>(members.size());
        for (MessageListenerContainer member : members) {
            String name = nameOf(member);
            WorkerRegistry.WorkerActivity activity = workerRegistry.activity(name).orElse(null);
            snapshots.add(new WorkerSnapshot(
                    name,
                    member.isRunning(),
                    activity != null ? activity.getActiveJobId() : null,
                    activity != null ? activity.getActiveSince() : null,
                    partitionsOf(member),
                    activity != null ? activity.getJobsCompleted() : 0));
        }
        return snapshots;
    }

    public WorkerDiagnostics diagnostics() {
        long scheduled;
        try {
            scheduled = jobService.countPending();
        } catch (RuntimeException e) {
            log.warn("Could not count pending batch jobs: {}", e.getMessage());
            scheduled = -1;
        }
        return new WorkerDiagnostics(workers(), scheduled);
    }

    private static String nameOf(MessageListenerContainer container) {
        if (container instanceof AbstractMessageListenerContainer) {
            String beanName = ((AbstractMessageListenerContainer<?, ?>) container).getBeanName();
            if (beanName != null) {
                return beanName;
            }
        }
        return container.getListenerId();
    }

    private static List<String> partitionsOf(MessageListenerContainer container) {
        Collection<TopicPartition> assigned = container.getAssignedPartitions();
        if (assigned == null) {
            return List.of();
        }
        return assigned.stream()
                .map(TopicPartition::toString)
                .sorted()
                .collect(Collectors.toList());
    }
}
