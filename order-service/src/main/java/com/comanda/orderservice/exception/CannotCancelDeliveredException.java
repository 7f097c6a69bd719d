package com.comanda.orderservice.exception;

public class CannotCancelDeliveredException extends RuntimeException {

    public CannotCancelDeliveredException(String message) {
        super(message);
    }
}
