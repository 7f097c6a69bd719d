package com.comanda.orderservice.exception;

public class AlreadyCancelledException extends RuntimeException {

    public AlreadyCancelledException(String message) {
        super(message);
    }
}
