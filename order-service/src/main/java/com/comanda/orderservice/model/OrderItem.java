// order-service/src/main/java/com/comanda/orderservice/model/OrderItem.java
package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A single order line. Written once together with its order and never updated.
 */
@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @Column(name = "menu_item_id", nullable = false, updatable = false)
    @ToString.Include
    private Long menuItemId;

    // name snapshot at order time
    @Column(name = "menu_item_name", nullable = false, updatable = false)
    private String menuItemName;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private Integer quantity;

    @Column(name = "price_at_order", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal priceAtOrder;

    @Column(length = 200, updatable = false)
    private String notes;

    public BigDecimal getLineTotal() {
        return priceAtOrder.multiply(BigDecimal.valueOf(quantity));
    }
}
