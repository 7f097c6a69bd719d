package com.comanda.orderservice.model;

public enum OrderType {
    DINE_IN,
    TAKE_OUT,
    DELIVERY,
    EXTERNAL // placed through an external channel, carries externalOrderId
}
