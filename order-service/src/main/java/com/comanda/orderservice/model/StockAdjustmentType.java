package com.comanda.orderservice.model;

public enum StockAdjustmentType {
    DAILY_RESET,
    MANUAL_ADD,
    MANUAL_REMOVE,
    ORDER_DEDUCT,
    ORDER_CANCELLED,
    // availability flipped off at zero stock; quantity is always 0
    AUTO_BLOCKED
}
