package com.comanda.orderservice.service;

import com.comanda.common.dto.PageResponse;
import com.comanda.orderservice.dto.DailyResetRequest;
import com.comanda.orderservice.dto.InventoryTypeRequest;
import com.comanda.orderservice.dto.MenuItemResponse;
import com.comanda.orderservice.dto.StockAdjustmentResponse;

import java.util.List;
import java.util.UUID;

/**
 * Stock ledger for tracked menu items.
 *
 * Every mutating method locks the item row (SELECT ... FOR UPDATE), performs
 * its read-modify-write and appends a stock adjustment row. The lock is held
 * until the surrounding transaction commits, so callers that are already in a
 * transaction (order creation, cancellation) keep all their item locks until
 * their whole unit is done.
 */
public interface StockService {

    /**
     * Adds stock to a TRACKED item and writes a MANUAL_ADD row.
     */
    MenuItemResponse addStock(Long itemId, int quantity, String reason, UUID actorId);

    /**
     * Removes stock from a TRACKED item and writes a MANUAL_REMOVE row.
     * Fails with InsufficientStockException if the result would be negative.
     */
    MenuItemResponse removeStock(Long itemId, int quantity, String reason, UUID actorId);

    /**
     * Deducts an order line. Sufficiency is checked again under the row lock;
     * any earlier check is advisory only.
     */
    void deductStockForOrder(Long itemId, int quantity, UUID orderId);

    /**
     * Gives a cancelled order line back to stock.
     */
    void revertStockForOrder(Long itemId, int quantity, UUID orderId);

    /**
     * Sets stock and initial stock of each listed item in one transaction.
     * Items are locked in ascending id order.
     */
    List<MenuItemResponse> dailyStockReset(DailyResetRequest request, UUID actorId);

    MenuItemResponse setInventoryType(Long itemId, InventoryTypeRequest request, UUID actorId);

    List<MenuItemResponse> findLowStock();

    List<MenuItemResponse> findOutOfStock();

    /**
     * Audit trail of one item, newest first. {@code page} is 1-based.
     */
    PageResponse<StockAdjustmentResponse> findHistory(Long itemId, int page, int limit);
}
