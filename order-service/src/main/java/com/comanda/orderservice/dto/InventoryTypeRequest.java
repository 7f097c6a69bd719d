package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.InventoryType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryTypeRequest {
    @NotNull(message = "Inventory type cannot be null")
    private InventoryType inventoryType;

    @Min(value = 1, message = "Low stock alert must be at least 1")
    private Integer lowStockAlert;

    // seed stock when switching to TRACKED
    @Min(value = 0, message = "Initial stock cannot be negative")
    @Max(value = 1000000, message = "Initial stock cannot exceed 1000000")
    private Integer initialStock;
}
