package com.fritter.freet.event;

import com.fritter.freet.config.FritterProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringJUnitConfig(ModerationEventPublisherAsyncTest.AsyncPublisherConfig.class)
@DisplayName("ModerationEventPublisher Async Tests")
class ModerationEventPublisherAsyncTest {

    @Configuration
    @EnableAsync
    static class AsyncPublisherConfig {

        @Bean
        @SuppressWarnings("unchecked")
        KafkaTemplate<String, Object> kafkaTemplate() {
            return mock(KafkaTemplate.class);
        }

        @Bean
        FritterProperties fritterProperties() {
            return new FritterProperties();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        ModerationEventPublisher moderationEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                                                          FritterProperties properties,
                                                          MeterRegistry meterRegistry) {
            return new ModerationEventPublisher(kafkaTemplate, properties, meterRegistry);
        }
    }

    @Autowired
    private ModerationEventPublisher publisher;

    @Autowired
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Autowired
    private MeterRegistry meterRegistry;

    private final CountDownLatch brokerAnswers = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        brokerAnswers.countDown();
        reset(kafkaTemplate);
    }

    @Test
    @DisplayName("Caller should return while the producer is still blocked on the broker")
    void callerShouldNotWaitForBlockedProducer() throws Exception {
        // Arrange: send blocks the way the producer does while waiting for metadata
        CountDownLatch sendStarted = new CountDownLatch(1);
        AtomicReference<Thread> sendingThread = new AtomicReference<>();
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenAnswer(inv -> {
            sendingThread.set(Thread.currentThread());
            sendStarted.countDown();
            brokerAnswers.await(10, TimeUnit.SECONDS);
            throw new TimeoutException("Topic fritter.moderation-events not present in metadata after 5000 ms.");
        });
        FreetModerationEvent event = FreetModerationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(FreetModerationEvent.EventType.AUDIT_STARTED)
                .freetId(UUID.randomUUID())
                .build();

        // Act
        assertTimeout(Duration.ofSeconds(1), () -> publisher.onModerationEvent(event));

        // Assert
        assertThat(sendStarted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(sendingThread.get()).isNotSameAs(Thread.currentThread());
        assertThat(meterRegistry.counter("fritter.moderation.events.failed", "type", "AUDIT_STARTED").count())
                .isZero();

        brokerAnswers.countDown();
        verify(kafkaTemplate, timeout(5000)).send(eq("fritter.moderation-events"), anyString(), eq(event));
    }

    @Test
    @DisplayName("Failures on the async executor should still be counted")
    void asyncFailuresShouldBeCounted() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenAnswer(inv -> {
            CompletableFuture<Object> future = CompletableFuture.failedFuture(new IllegalStateException("broker down"));
            failed.countDown();
            return future;
        });
        FreetModerationEvent event = FreetModerationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(FreetModerationEvent.EventType.AUDIT_PASSED)
                .freetId(UUID.randomUUID())
                .build();

        publisher.onModerationEvent(event);

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        long deadline = System.currentTimeMillis() + 5000;
        while (meterRegistry.counter("fritter.moderation.events.failed", "type", "AUDIT_PASSED").count() < 1
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(meterRegistry.counter("fritter.moderation.events.failed", "type", "AUDIT_PASSED").count())
                .isEqualTo(1.0);
    }
}
