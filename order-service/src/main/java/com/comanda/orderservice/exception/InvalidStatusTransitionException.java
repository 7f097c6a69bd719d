package com.comanda.orderservice.exception;

/**
 * Exception thrown when the generic status update is asked to leave a terminal
 * state, to set CANCELLED directly, or (strict mode) to skip a step.
 * HTTP Status: 400 Bad Request
 */
public class InvalidStatusTransitionException extends RuntimeException {

    public InvalidStatusTransitionException(String message) {
        super(message);
    }
}
