// order-service/src/main/java/com/comanda/orderservice/dto/OrderItemRequest.java
package com.comanda.orderservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class OrderItemRequest {
    @NotNull(message = "Menu item ID cannot be null")
    private Long menuItemId;

    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 1000000, message = "Quantity cannot exceed 1000000")
    private Integer quantity;

    @Size(max = 200, message = "Item notes cannot exceed 200 characters")
    private String notes;
}
