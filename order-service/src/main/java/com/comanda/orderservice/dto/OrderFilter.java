package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.model.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

// Every field is optional; null means "no restriction"
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderFilter {
    private OrderStatus status;
    private OrderType type;
    private UUID waiterId;
    private Long tableId;
    private LocalDate date;
}
