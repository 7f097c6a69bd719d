package com.comanda.orderservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockChangeRequest {
    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be greater than 0")
    @Max(value = 1000000, message = "Quantity cannot exceed 1000000")
    private Integer quantity;

    @Size(min = 3, max = 255, message = "Reason must be between 3 and 255 characters")
    private String reason;
}
