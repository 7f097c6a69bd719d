package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.InventoryType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class MenuItemResponse {
    private Long id;
    private Long categoryId;
    private String name;
    private String description;
    private BigDecimal price;
    private Boolean isAvailable;
    private InventoryType inventoryType;
    // null for UNLIMITED items
    private Integer stockQuantity;
    private Integer initialStock;
    private Integer lowStockAlert;
    private Boolean autoMarkUnavailable;
}
