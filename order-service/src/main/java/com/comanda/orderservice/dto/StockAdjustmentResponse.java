package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.StockAdjustmentType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class StockAdjustmentResponse {
    private UUID id;
    private Long menuItemId;
    private StockAdjustmentType adjustmentType;
    private Integer previousStock;
    private Integer newStock;
    private Integer quantity;
    private String reason;
    private UUID userId;
    private UUID orderId;
    private Instant createdAt;
}
