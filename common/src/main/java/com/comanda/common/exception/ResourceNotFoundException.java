package com.comanda.common.exception;

/**
 * Exception thrown when an order or a menu item cannot be found
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
