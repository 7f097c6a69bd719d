package com.comanda.orderservice.controller;

import com.comanda.common.dto.PageResponse;
import com.comanda.orderservice.dto.DailyResetRequest;
import com.comanda.orderservice.dto.InventoryTypeRequest;
import com.comanda.orderservice.dto.MenuItemResponse;
import com.comanda.orderservice.dto.StockAdjustmentResponse;
import com.comanda.orderservice.dto.StockChangeRequest;
import com.comanda.orderservice.service.MenuItemService;
import com.comanda.orderservice.service.StockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/menu-items")
@RequiredArgsConstructor
public class MenuItemController {

    private final MenuItemService menuItemService;
    private final StockService stockService;

    /**
     * STOCK REPORTS
     */

    @GetMapping("/stock/low")
    public ResponseEntity<List<MenuItemResponse>> findLowStock() {
        return ResponseEntity.ok(stockService.findLowStock());
    }

    @GetMapping("/stock/out")
    public ResponseEntity<List<MenuItemResponse>> findOutOfStock() {
        return ResponseEntity.ok(stockService.findOutOfStock());
    }

    @PostMapping("/stock/daily-reset")
    public ResponseEntity<List<MenuItemResponse>> dailyStockReset(
            @Valid @RequestBody DailyResetRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = UUID.fromString(jwt.getSubject());
        return ResponseEntity.ok(stockService.dailyStockReset(request, actorId));
    }

    /**
     * SINGLE ITEM
     */

    @GetMapping("/{itemId}")
    public ResponseEntity<MenuItemResponse> getMenuItem(@PathVariable Long itemId) {
        return ResponseEntity.ok(menuItemService.getMenuItem(itemId));
    }

    @PostMapping("/{itemId}/stock/add")
    public ResponseEntity<MenuItemResponse> addStock(
            @PathVariable Long itemId,
            @Valid @RequestBody StockChangeRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = UUID.fromString(jwt.getSubject());
        return ResponseEntity.ok(stockService.addStock(itemId, request.getQuantity(), request.getReason(), actorId));
    }

    @PostMapping("/{itemId}/stock/remove")
    public ResponseEntity<MenuItemResponse> removeStock(
            @PathVariable Long itemId,
            @Valid @RequestBody StockChangeRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = UUID.fromString(jwt.getSubject());
        return ResponseEntity.ok(stockService.removeStock(itemId, request.getQuantity(), request.getReason(), actorId));
    }

    @PatchMapping("/{itemId}/inventory-type")
    public ResponseEntity<MenuItemResponse> setInventoryType(
            @PathVariable Long itemId,
            @Valid @RequestBody InventoryTypeRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID actorId = UUID.fromString(jwt.getSubject());
        return ResponseEntity.ok(stockService.setInventoryType(itemId, request, actorId));
    }

    @GetMapping("/{itemId}/stock/history")
    public ResponseEntity<PageResponse<StockAdjustmentResponse>> findHistory(
            @PathVariable Long itemId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(stockService.findHistory(itemId, page, limit));
    }
}
