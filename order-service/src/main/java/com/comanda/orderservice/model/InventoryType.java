package com.comanda.orderservice.model;

public enum InventoryType {
    TRACKED,   // finite stock, decremented by orders
    UNLIMITED  // no stock fields, only the availability flag applies
}
