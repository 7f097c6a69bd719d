// order-service/src/main/java/com/comanda/orderservice/model/OrderStatus.java
package com.comanda.orderservice.model;

/**
 * Order workflow states in their forward order.
 * DELIVERED and CANCELLED are terminal.
 */
public enum OrderStatus {
    PENDING,
    SENT_TO_CASHIER,
    PAID,
    IN_KITCHEN,
    READY,
    DELIVERED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * The next state in the forward sequence, or null for a terminal state.
     */
    public OrderStatus next() {
        return switch (this) {
            case PENDING -> SENT_TO_CASHIER;
            case SENT_TO_CASHIER -> PAID;
            case PAID -> IN_KITCHEN;
            case IN_KITCHEN -> READY;
            case READY -> DELIVERED;
            case DELIVERED, CANCELLED -> null;
        };
    }
}
