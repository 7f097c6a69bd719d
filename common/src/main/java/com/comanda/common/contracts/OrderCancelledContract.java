package com.comanda.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Published once an order has been cancelled and its tracked stock returned.
 * {@code restoredItems} lists only the lines whose stock was actually reverted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCancelledContract {
    private UUID orderId;
    private UUID waiterId;
    private Long tableId;
    private String oldStatus;
    private List<OrderLineContract> restoredItems;
}
