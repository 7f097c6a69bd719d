package com.comanda.orderservice.job;

import com.comanda.orderservice.model.OutboxEvent;
import com.comanda.orderservice.repository.OutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPublisher Unit Tests")
class OutboxPublisherTest {

    @Mock
    private OutboxRepository outboxRepository;
    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private OutboxPublisher outboxPublisher;

    private OutboxEvent orderEvent;
    private OutboxEvent stockEvent;

    @BeforeEach
    void setUp() {
        orderEvent = OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(OutboxEvent.AGGREGATE_ORDER)
                .aggregateId("order-123")
                .type("order.created")
                .payload("{\"orderId\":\"order-123\",\"status\":\"PENDING\"}")
                .createdAt(LocalDateTime.now().minusMinutes(5))
                .processed(false)
                .build();

        stockEvent = OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(OutboxEvent.AGGREGATE_MENU_ITEM)
                .aggregateId("42")
                .type("stock.depleted")
                .payload("{\"menuItemId\":42,\"stockQuantity\":0}")
                .createdAt(LocalDateTime.now().minusMinutes(3))
                .processed(false)
                .build();
    }

    @Nested
    @DisplayName("Publishing")
    class PublishingTests {

        @Test
        @DisplayName("should do nothing when no events are pending")
        void shouldDoNothingWhenNoEventsPending() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc())
                    .thenReturn(Collections.emptyList());

            outboxPublisher.publishOutboxEvents();

            verify(rabbitTemplate, never()).send(anyString(), anyString(), any(Message.class));
            verify(outboxRepository, never()).save(any());
        }

        @Test
        @DisplayName("should route every event to the events exchange by its type")
        void shouldRouteByType() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc())
                    .thenReturn(List.of(orderEvent, stockEvent));

            outboxPublisher.publishOutboxEvents();

            verify(rabbitTemplate).send(eq("comanda_events_exchange"), eq("order.created"), any(Message.class));
            verify(rabbitTemplate).send(eq("comanda_events_exchange"), eq("stock.depleted"), any(Message.class));
            assertThat(orderEvent.isProcessed()).isTrue();
            assertThat(stockEvent.isProcessed()).isTrue();
            verify(outboxRepository, times(2)).save(any(OutboxEvent.class));
        }

        @Test
        @DisplayName("should send raw JSON payload with message id")
        void shouldSendRawJsonPayload() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc())
                    .thenReturn(List.of(orderEvent));
            ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);

            outboxPublisher.publishOutboxEvents();

            verify(rabbitTemplate).send(anyString(), anyString(), captor.capture());
            Message message = captor.getValue();
            assertThat(new String(message.getBody(), StandardCharsets.UTF_8)).isEqualTo(orderEvent.getPayload());
            assertThat(message.getMessageProperties().getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
            assertThat(message.getMessageProperties().getMessageId()).isEqualTo(orderEvent.getId().toString());
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandlingTests {

        @Test
        @DisplayName("should leave event unprocessed when broker is down and continue with the rest")
        void shouldLeaveEventUnprocessedOnFailure() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc())
                    .thenReturn(List.of(orderEvent, stockEvent));
            doThrow(new AmqpConnectException(new ConnectException("Connection refused")))
                    .when(rabbitTemplate).send(anyString(), eq("order.created"), any(Message.class));

            outboxPublisher.publishOutboxEvents();

            assertThat(orderEvent.isProcessed()).isFalse();
            assertThat(stockEvent.isProcessed()).isTrue();
            verify(outboxRepository).save(stockEvent);
            verify(outboxRepository, never()).save(orderEvent);
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class CleanupTests {

        @Test
        @DisplayName("should delete processed events in batches until none are left")
        void shouldDeleteInBatches() {
            OutboxEvent processed = OutboxEvent.builder().id(UUID.randomUUID()).processed(true).build();
            when(outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(any(LocalDateTime.class)))
                    .thenReturn(List.of(processed))
                    .thenReturn(Collections.emptyList());

            outboxPublisher.cleanupProcessedEvents();

            verify(outboxRepository, times(1)).deleteAll(List.of(processed));
            verify(outboxRepository, times(2)).findTop1000ByProcessedTrueAndCreatedAtBefore(any(LocalDateTime.class));
        }
    }
}
