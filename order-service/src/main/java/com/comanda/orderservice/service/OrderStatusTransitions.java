package com.comanda.orderservice.service;

import com.comanda.orderservice.exception.InvalidStatusTransitionException;
import com.comanda.orderservice.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Validates moves requested through the generic status update.
 *
 * Always rejected: leaving DELIVERED or CANCELLED, and setting CANCELLED
 * (cancellation has its own operation because it returns stock).
 * In strict mode only the next forward state is accepted; otherwise any
 * other target is allowed.
 */
@Component
public class OrderStatusTransitions {

    private static final Logger log = LoggerFactory.getLogger(OrderStatusTransitions.class);

    private final boolean strict;

    public OrderStatusTransitions(@Value("${comanda.orders.strict-status-transitions:false}") boolean strict) {
        this.strict = strict;
        log.info("Order status transitions configured: strict={}", strict);
    }

    public void validate(UUID orderId, OrderStatus current, OrderStatus target) {
        if (current.isTerminal()) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedStatus={}",
                    orderId, current, target);
            throw new InvalidStatusTransitionException(
                    "Cannot change status of " + current.name().toLowerCase() + " order");
        }
        if (target == OrderStatus.CANCELLED) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedStatus=CANCELLED",
                    orderId, current);
            throw new InvalidStatusTransitionException("Use the cancel operation to cancel an order");
        }
        if (strict && target != current.next()) {
            log.warn("Out-of-sequence transition rejected: orderId={}, currentStatus={}, attemptedStatus={}",
                    orderId, current, target);
            throw new InvalidStatusTransitionException(
                    "Order status must move from " + current + " to " + current.next() + ", not " + target);
        }
    }
}
