package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row, one per stock mutation.
 */
@Entity
@Immutable
@Table(name = "stock_adjustments", indexes = {
        @Index(name = "idx_stock_adjustments_item_created", columnList = "menu_item_id, created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class StockAdjustment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "menu_item_id", nullable = false, updatable = false)
    private Long menuItemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "adjustment_type", nullable = false, updatable = false)
    private StockAdjustmentType adjustmentType;

    @Column(name = "previous_stock", nullable = false, updatable = false)
    private Integer previousStock;

    @Column(name = "new_stock", nullable = false, updatable = false)
    private Integer newStock;

    // signed delta (newStock - previousStock)
    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(updatable = false)
    private String reason;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
