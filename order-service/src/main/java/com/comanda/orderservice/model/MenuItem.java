package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.SQLRestriction;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Menu item as seen by the order engine. Catalog fields are owned by the menu
 * subsystem; the stock fields are only written through the stock ledger.
 *
 * For UNLIMITED items stockQuantity, initialStock and lowStockAlert are null.
 * Soft-deleted rows are hidden from every query.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "menu_items")
@SQLRestriction("deleted = false")
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @Column(name = "category_id")
    private Long categoryId;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Builder.Default
    @Column(name = "is_available", nullable = false)
    private Boolean isAvailable = true;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "inventory_type", nullable = false)
    @ToString.Include
    private InventoryType inventoryType = InventoryType.UNLIMITED;

    @Column(name = "stock_quantity")
    @ToString.Include
    private Integer stockQuantity;

    @Column(name = "initial_stock")
    private Integer initialStock;

    @Column(name = "low_stock_alert")
    private Integer lowStockAlert;

    @Builder.Default
    @Column(name = "auto_mark_unavailable", nullable = false)
    private Boolean autoMarkUnavailable = true;

    @Builder.Default
    @Column(nullable = false)
    private Boolean deleted = false;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isTracked() {
        return inventoryType == InventoryType.TRACKED;
    }
}
