// order-service/src/main/java/com/comanda/orderservice/service/OrderServiceImpl.java
package com.comanda.orderservice.service;

import com.comanda.common.contracts.OrderCancelledContract;
import com.comanda.common.contracts.OrderLineContract;
import com.comanda.common.contracts.OrderStatusChangeContract;
import com.comanda.common.dto.PageResponse;
import com.comanda.common.exception.InsufficientStockException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.config.AmqpConfig;
import com.comanda.orderservice.dto.OrderFilter;
import com.comanda.orderservice.dto.OrderItemRequest;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.exception.AlreadyCancelledException;
import com.comanda.orderservice.exception.CannotCancelDeliveredException;
import com.comanda.orderservice.exception.ItemsUnavailableException;
import com.comanda.orderservice.mapper.OrderMapper;
import com.comanda.orderservice.model.MenuItem;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderItem;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.model.OutboxEvent;
import com.comanda.orderservice.repository.OrderRepository;
import com.comanda.orderservice.repository.OrderSpecifications;
import com.comanda.orderservice.repository.OutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final MenuItemService menuItemService;
    private final StockService stockService;
    private final OrderStatusTransitions statusTransitions;
    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Value("${comanda.orders.zone-id:UTC}")
    private String zoneId = "UTC";

    @Override
    @Transactional
    public OrderResponse createOrder(OrderRequest orderRequest, Jwt jwt) {
        UUID waiterId = UUID.fromString(jwt.getSubject());
        log.info("Order creation process started. waiterId={}, type={}, tableId={}, lines={}",
                waiterId, orderRequest.getType(), orderRequest.getTableId(), orderRequest.getItems().size());

        Set<Long> menuItemIds = new LinkedHashSet<>();
        orderRequest.getItems().forEach(line -> menuItemIds.add(line.getMenuItemId()));

        // One query for all referenced items
        Map<Long, MenuItem> menuItems = menuItemService.findAllByIds(menuItemIds);

        List<Long> missing = menuItemIds.stream()
                .filter(id -> !menuItems.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Menu items not found: menuItemIds={}", missing);
            throw new ResourceNotFoundException("Menu items not found: " + missing);
        }

        List<String> unavailable = menuItemIds.stream()
                .map(menuItems::get)
                .filter(item -> !Boolean.TRUE.equals(item.getIsAvailable()))
                .map(MenuItem::getName)
                .toList();
        if (!unavailable.isEmpty()) {
            log.warn("Order rejected, items not available: {}", unavailable);
            throw new ItemsUnavailableException(unavailable);
        }

        // Advisory pre-check; the locked deduction below is authoritative
        Map<Long, Integer> requested = new TreeMap<>();
        orderRequest.getItems().forEach(line -> requested.merge(line.getMenuItemId(), line.getQuantity(), Integer::sum));
        requested.forEach((menuItemId, quantity) -> {
            MenuItem item = menuItems.get(menuItemId);
            if (item.isTracked() && item.getStockQuantity() < quantity) {
                log.warn("Insufficient stock: menuItemId={}, name='{}', stock={}, requested={}",
                        menuItemId, item.getName(), item.getStockQuantity(), quantity);
                throw new InsufficientStockException("Insufficient stock for " + item.getName(), menuItemId);
            }
        });

        Order order = new Order();
        order.setWaiterId(waiterId);
        order.setTableId(orderRequest.getTableId());
        order.setCustomerId(orderRequest.getCustomerId());
        order.setType(orderRequest.getType());
        order.setNotes(orderRequest.getNotes());
        order.setExternalOrderId(orderRequest.getExternalOrderId());
        order.setStatus(OrderStatus.PENDING);
        order.setTotalAmount(BigDecimal.ZERO);

        BigDecimal totalAmount = BigDecimal.ZERO;
        for (OrderItemRequest reqItem : orderRequest.getItems()) {
            MenuItem menuItem = menuItems.get(reqItem.getMenuItemId());

            OrderItem item = new OrderItem();
            item.setMenuItemId(menuItem.getId());
            item.setMenuItemName(menuItem.getName());
            item.setPriceAtOrder(menuItem.getPrice());
            item.setQuantity(reqItem.getQuantity());
            item.setNotes(reqItem.getNotes());
            order.addItem(item);

            totalAmount = totalAmount.add(item.getLineTotal());
        }

        Order savedOrder = orderRepository.save(order);
        savedOrder.setTotalAmount(totalAmount);
        log.info("Order saved to database. orderId={}, totalAmount={}", savedOrder.getId(), totalAmount);

        // Lock order: ascending menu item id
        List<OrderItem> trackedLines = savedOrder.getItems().stream()
                .filter(line -> menuItems.get(line.getMenuItemId()).isTracked())
                .sorted(Comparator.comparing(OrderItem::getMenuItemId))
                .toList();
        for (OrderItem line : trackedLines) {
            stockService.deductStockForOrder(line.getMenuItemId(), line.getQuantity(), savedOrder.getId());
        }

        saveOutboxEvent(savedOrder.getId().toString(), AmqpConfig.ROUTING_KEY_ORDER_CREATED,
                statusContract(savedOrder, null));
        log.info("'order.created' event saved to Outbox. orderId={}", savedOrder.getId());

        return orderMapper.toOrderResponse(savedOrder);
    }

    @Override
    @Transactional
    public OrderResponse updateOrderStatus(UUID orderId, OrderStatus status, Jwt jwt) {
        log.info("Status update started. orderId={}, requestedStatus={}", orderId, status);

        Order order = findOrderWithLock(orderId);
        OrderStatus oldStatus = order.getStatus();
        statusTransitions.validate(orderId, oldStatus, status);

        if (oldStatus == status) {
            log.info("Order already in requested status: orderId={}, status={}", orderId, status);
            return orderMapper.toOrderResponse(order);
        }

        order.setStatus(status);
        Order updatedOrder = orderRepository.save(order);
        log.info("Order status updated: orderId={}, from={}, to={}, updatedBy={}",
                orderId, oldStatus, status, jwt.getSubject());

        saveOutboxEvent(updatedOrder.getId().toString(), AmqpConfig.ROUTING_KEY_ORDER_STATUS_CHANGED,
                statusContract(updatedOrder, oldStatus));

        return orderMapper.toOrderResponse(updatedOrder);
    }

    /**
     * Cancels an order. The status guard, the stock reversion of every tracked
     * line and the status flip all happen under the order row lock in one
     * transaction.
     */
    @Override
    @Transactional
    public OrderResponse cancelOrder(UUID orderId, Jwt jwt) {
        log.info("Cancel order process started. orderId={}", orderId);

        Order order = findOrderWithLock(orderId);
        OrderStatus oldStatus = order.getStatus();

        if (oldStatus == OrderStatus.DELIVERED) {
            log.warn("Invalid state transition: orderId={}, currentStatus=DELIVERED, attemptedAction=cancel",
                    orderId);
            throw new CannotCancelDeliveredException("Cannot cancel a delivered order");
        }
        if (oldStatus == OrderStatus.CANCELLED) {
            log.warn("Invalid state transition: orderId={}, currentStatus=CANCELLED, attemptedAction=cancel",
                    orderId);
            throw new AlreadyCancelledException("Order is already cancelled");
        }

        Set<Long> menuItemIds = new LinkedHashSet<>();
        order.getItems().forEach(line -> menuItemIds.add(line.getMenuItemId()));
        Map<Long, MenuItem> menuItems = menuItemService.findAllByIds(menuItemIds);

        List<OrderItem> lines = new ArrayList<>(order.getItems());
        lines.sort(Comparator.comparing(OrderItem::getMenuItemId));

        List<OrderItem> restored = new ArrayList<>();
        for (OrderItem line : lines) {
            MenuItem menuItem = menuItems.get(line.getMenuItemId());
            if (menuItem == null) {
                log.warn("Menu item no longer exists, stock not reverted: orderId={}, menuItemId={}",
                        orderId, line.getMenuItemId());
                continue;
            }
            if (!menuItem.isTracked()) {
                continue;
            }
            stockService.revertStockForOrder(line.getMenuItemId(), line.getQuantity(), orderId);
            restored.add(line);
        }

        order.setStatus(OrderStatus.CANCELLED);
        Order updatedOrder = orderRepository.save(order);
        log.info("Order status updated: orderId={}, from={}, to={}, restoredLines={}, cancelledBy={}",
                orderId, oldStatus, OrderStatus.CANCELLED, restored.size(), jwt.getSubject());

        List<OrderLineContract> restoredItems = orderMapper.toLineContracts(restored);
        OrderCancelledContract contract = OrderCancelledContract.builder()
                .orderId(updatedOrder.getId())
                .waiterId(updatedOrder.getWaiterId())
                .tableId(updatedOrder.getTableId())
                .oldStatus(oldStatus.name())
                .restoredItems(restoredItems)
                .build();
        saveOutboxEvent(updatedOrder.getId().toString(), AmqpConfig.ROUTING_KEY_ORDER_CANCELLED, contract);
        log.info("'order.cancelled' event saved to Outbox with oldStatus={}: orderId={}", oldStatus, orderId);

        return orderMapper.toOrderResponse(updatedOrder);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResponse<OrderResponse> findOrders(OrderFilter filter, int page, int limit) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be at least 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        PageRequest pageRequest = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Order> orders = orderRepository.findAll(
                OrderSpecifications.matching(filter, ZoneId.of(zoneId)), pageRequest);

        return PageResponse.of(
                orders.getContent().stream().map(orderMapper::toOrderResponse).toList(),
                orders.getTotalElements(), page, limit);
    }

    private Order findOrderWithLock(UUID orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    private OrderStatusChangeContract statusContract(Order order, OrderStatus oldStatus) {
        return OrderStatusChangeContract.builder()
                .orderId(order.getId())
                .waiterId(order.getWaiterId())
                .tableId(order.getTableId())
                .type(order.getType().name())
                .oldStatus(oldStatus != null ? oldStatus.name() : null)
                .status(order.getStatus().name())
                .totalAmount(order.getTotalAmount())
                .items(orderMapper.toLineContracts(order.getItems()))
                .createdAt(order.getCreatedAt())
                .build();
    }

    private void saveOutboxEvent(String aggregateId, String type, Object payloadObj) {
        try {
            String payload = objectMapper.writeValueAsString(payloadObj);
            OutboxEvent event = OutboxEvent.builder()
                    .aggregateType(OutboxEvent.AGGREGATE_ORDER)
                    .aggregateId(aggregateId)
                    .type(type)
                    .payload(payload)
                    .createdAt(LocalDateTime.now())
                    .processed(false)
                    .build();
            outboxRepository.save(event);
        } catch (Exception e) {
            log.error("ERROR occurred while saving event to Outbox. aggregateId={}, type={}", aggregateId, type, e);
            throw new RuntimeException("Failed to serialize/save outbox event", e);
        }
    }
}
