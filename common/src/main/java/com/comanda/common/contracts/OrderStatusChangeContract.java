package com.comanda.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published on order creation and on every status change.
 * Routing keys: order.created, order.status_changed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangeContract {
    private UUID orderId;
    private UUID waiterId;
    private Long tableId;
    private String type;
    private String oldStatus; // null for order.created
    private String status;
    private BigDecimal totalAmount;
    private List<OrderLineContract> items;
    private Instant createdAt;
}
