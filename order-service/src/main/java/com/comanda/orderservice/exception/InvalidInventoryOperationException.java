package com.comanda.orderservice.exception;

/**
 * Exception thrown for stock operations that do not apply to the item's
 * inventory type, e.g. adding stock to an UNLIMITED item.
 * HTTP Status: 400 Bad Request
 */
public class InvalidInventoryOperationException extends RuntimeException {

    public InvalidInventoryOperationException(String message) {
        super(message);
    }

    public InvalidInventoryOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
