package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.model.OrderType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private UUID waiterId;
    private Long tableId;
    private UUID customerId;
    private OrderType type;
    private OrderStatus status;
    private BigDecimal totalAmount;
    private String notes;
    private String externalOrderId;
    private List<OrderItemResponse> items;
    private Instant createdAt;
    private Instant updatedAt;
}
