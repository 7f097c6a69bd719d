package com.comanda.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stock alert for a tracked menu item. Routing keys: stock.low, stock.depleted
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockLevelContract {
    private Long menuItemId;
    private String name;
    private Integer stockQuantity;
    private Integer lowStockAlert;
    private boolean available;
}
