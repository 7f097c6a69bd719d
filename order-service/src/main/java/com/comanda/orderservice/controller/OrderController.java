// order-service/src/main/java/com/comanda/orderservice/controller/OrderController.java
package com.comanda.orderservice.controller;

import com.comanda.common.dto.PageResponse;
import com.comanda.orderservice.dto.OrderFilter;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.dto.UpdateOrderStatusRequest;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.model.OrderType;
import com.comanda.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createOrder(orderRequest, jwt);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<PageResponse<OrderResponse>> findOrders(
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(required = false) OrderType type,
            @RequestParam(required = false) UUID waiterId,
            @RequestParam(required = false) Long tableId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        OrderFilter filter = OrderFilter.builder()
                .status(status)
                .type(type)
                .waiterId(waiterId)
                .tableId(tableId)
                .date(date)
                .build();
        return ResponseEntity.ok(orderService.findOrders(filter, page, limit));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.getOrderById(orderId));
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateOrderStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.updateOrderStatus(orderId, request.getStatus(), jwt);
        return ResponseEntity.ok(response);
    }

    // Cancellation. Orders are never physically deleted.
    @DeleteMapping("/{orderId}")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.cancelOrder(orderId, jwt);
        return ResponseEntity.ok(response);
    }
}
