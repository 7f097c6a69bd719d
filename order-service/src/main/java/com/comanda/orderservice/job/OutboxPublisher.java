package com.comanda.orderservice.job;

import com.comanda.orderservice.config.AmqpConfig;
import com.comanda.orderservice.model.OutboxEvent;
import com.comanda.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays committed outbox rows to RabbitMQ. A row is marked processed only
 * after a successful send, so a broker outage delays events but never loses them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  private final OutboxRepository outboxRepository;
  private final RabbitTemplate rabbitTemplate;

  @Scheduled(fixedDelayString = "${comanda.outbox.publish-delay-ms:2000}")
  @Transactional
  public void publishOutboxEvents() {
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();

    if (events.isEmpty()) {
      return;
    }

    log.debug("Found {} outbox events to publish", events.size());

    for (OutboxEvent event : events) {
      try {
        // payload is already JSON
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setMessageId(event.getId().toString());

        Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);
        rabbitTemplate.send(AmqpConfig.EVENTS_EXCHANGE, event.getType(), message);

        event.setProcessed(true);
        outboxRepository.save(event);

        log.info("Published outbox event: id={}, type={}, aggregateId={}", event.getId(), event.getType(),
            event.getAggregateId());

      } catch (Exception e) {
        log.error("Failed to publish outbox event: id={}", event.getId(), e);
      }
    }
  }

  @Scheduled(cron = "${comanda.outbox.cleanup-cron:0 0 3 * * *}")
  @Transactional
  public void cleanupProcessedEvents() {
    LocalDateTime cutoff = LocalDateTime.now().minusDays(1);
    log.info("Starting cleanup of processed outbox events older than {}", cutoff);

    int totalDeleted = 0;
    while (true) {
      List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
      if (batch.isEmpty()) {
        break;
      }
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
      log.debug("Deleted batch of {} processed events", batch.size());
    }

    log.info("Cleanup completed. Total deleted: {}", totalDeleted);
  }
}
