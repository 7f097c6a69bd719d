// order-service/src/main/java/com/comanda/orderservice/service/OrderService.java
package com.comanda.orderservice.service;

import com.comanda.common.dto.PageResponse;
import com.comanda.orderservice.dto.OrderFilter;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.model.OrderStatus;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.UUID;

public interface OrderService {

    /**
     * Creates an order for the calling waiter.
     * Validates every referenced item, freezes prices, persists the order and
     * deducts tracked stock in a single transaction. Nothing is kept if any
     * step fails.
     */
    OrderResponse createOrder(OrderRequest orderRequest, Jwt jwt);

    /**
     * Moves a non-terminal order to another non-cancelled status.
     */
    OrderResponse updateOrderStatus(UUID orderId, OrderStatus status, Jwt jwt);

    /**
     * Cancels an order and returns its tracked stock in the same transaction.
     * Transition: any non-terminal -> CANCELLED
     */
    OrderResponse cancelOrder(UUID orderId, Jwt jwt);

    OrderResponse getOrderById(UUID orderId);

    /**
     * Lists orders newest first. {@code page} is 1-based.
     */
    PageResponse<OrderResponse> findOrders(OrderFilter filter, int page, int limit);
}
