package com.fritter.freet.event;

import com.fritter.freet.config.FritterProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed moderation decisions to Kafka.
 *
 * Runs after commit on the async executor, so neither a broker outage nor a producer
 * blocked on metadata holds up the request. Failures are logged and counted under
 * {@code fritter.moderation.events.failed}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ModerationEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final FritterProperties properties;
    private final MeterRegistry meterRegistry;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onModerationEvent(FreetModerationEvent event) {
        String topic = properties.getKafka().getModerationTopic();
        String key = event.getFreetId().toString();
        try {
            kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    recordFailure(event, ex);
                } else {
                    log.debug("Published {} for freet {} to {}-{}@{}", event.getEventType(), key,
                        topic, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                }
            });
        } catch (RuntimeException ex) {
            recordFailure(event, ex);
        }
    }

    private void recordFailure(FreetModerationEvent event, Throwable ex) {
        log.error("Failed to publish {} for freet {}", event.getEventType(), event.getFreetId(), ex);
        meterRegistry.counter("fritter.moderation.events.failed",
            "type", event.getEventType().name()).increment();
    }
}
