// order-service/src/main/java/com/comanda/orderservice/dto/OrderRequest.java
package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.OrderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class OrderRequest {
    @Min(value = 1, message = "Table ID must be positive")
    private Long tableId;

    private UUID customerId;

    @NotNull(message = "Order type cannot be null")
    private OrderType type;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid // validates each OrderItemRequest
    private List<OrderItemRequest> items;

    @Size(max = 500, message = "Order notes cannot exceed 500 characters")
    private String notes;

    @Size(max = 100, message = "External order ID cannot exceed 100 characters")
    private String externalOrderId;
}
