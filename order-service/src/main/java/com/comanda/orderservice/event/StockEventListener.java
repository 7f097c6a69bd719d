package com.comanda.orderservice.event;

import com.comanda.common.contracts.StockLevelContract;
import com.comanda.orderservice.model.OutboxEvent;
import com.comanda.orderservice.repository.OutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Writes stock alerts to the outbox table within the caller's transaction.
 */
@Component
@RequiredArgsConstructor
public class StockEventListener {

    private static final Logger log = LoggerFactory.getLogger(StockEventListener.class);

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @EventListener
    public void handleStockLevelEvent(StockLevelEvent event) {
        var item = event.getMenuItem();
        try {
            StockLevelContract contract = StockLevelContract.builder()
                    .menuItemId(item.getId())
                    .name(item.getName())
                    .stockQuantity(item.getStockQuantity())
                    .lowStockAlert(item.getLowStockAlert())
                    .available(Boolean.TRUE.equals(item.getIsAvailable()))
                    .build();

            OutboxEvent outboxEvent = OutboxEvent.builder()
                    .aggregateType(OutboxEvent.AGGREGATE_MENU_ITEM)
                    .aggregateId(item.getId().toString())
                    .type(event.getRoutingKey())
                    .payload(objectMapper.writeValueAsString(contract))
                    .createdAt(LocalDateTime.now())
                    .processed(false)
                    .build();
            outboxRepository.save(outboxEvent);

            log.info("Saved stock alert to Outbox: menuItemId={}, routingKey={}, stock={}",
                    item.getId(), event.getRoutingKey(), item.getStockQuantity());

        } catch (Exception e) {
            log.error("Failed to save stock alert to Outbox: menuItemId={}", item.getId(), e);
            // rolls back the stock change together with the missing alert
            throw new RuntimeException("Failed to save outbox event", e);
        }
    }
}
