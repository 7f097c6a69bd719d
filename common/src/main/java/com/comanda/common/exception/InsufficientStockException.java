package com.comanda.common.exception;

/**
 * Exception thrown when a tracked menu item does not hold enough stock
 * for a deduction or a manual removal
 * HTTP Status: 400 Bad Request
 */
public class InsufficientStockException extends RuntimeException {

    private final Long menuItemId;

    public InsufficientStockException(String message) {
        this(message, null);
    }

    public InsufficientStockException(String message, Long menuItemId) {
        super(message);
        this.menuItemId = menuItemId;
    }

    public Long getMenuItemId() {
        return menuItemId;
    }
}
