package com.comanda.orderservice.exception;

import java.util.List;

/**
 * Exception thrown when an order references menu items that are switched off.
 * Carries the names of every offending item, not just the first.
 * HTTP Status: 400 Bad Request
 */
public class ItemsUnavailableException extends RuntimeException {

    private final List<String> itemNames;

    public ItemsUnavailableException(List<String> itemNames) {
        super("The following items are not available: " + String.join(", ", itemNames));
        this.itemNames = List.copyOf(itemNames);
    }

    public List<String> getItemNames() {
        return itemNames;
    }
}
