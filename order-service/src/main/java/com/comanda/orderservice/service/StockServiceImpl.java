package com.comanda.orderservice.service;

import com.comanda.common.dto.PageResponse;
import com.comanda.common.exception.InsufficientStockException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.dto.DailyResetItem;
import com.comanda.orderservice.dto.DailyResetRequest;
import com.comanda.orderservice.dto.InventoryTypeRequest;
import com.comanda.orderservice.dto.MenuItemResponse;
import com.comanda.orderservice.dto.StockAdjustmentResponse;
import com.comanda.orderservice.event.StockLevelEvent;
import com.comanda.orderservice.exception.InvalidInventoryOperationException;
import com.comanda.orderservice.mapper.MenuItemMapper;
import com.comanda.orderservice.model.InventoryType;
import com.comanda.orderservice.model.MenuItem;
import com.comanda.orderservice.model.StockAdjustment;
import com.comanda.orderservice.model.StockAdjustmentType;
import com.comanda.orderservice.repository.MenuItemRepository;
import com.comanda.orderservice.repository.StockAdjustmentRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class StockServiceImpl implements StockService {

        private static final Logger log = LoggerFactory.getLogger(StockServiceImpl.class);

        static final int MAX_PAGE_SIZE = 100;
        static final String DAILY_RESET_REASON = "Begin of the day";

        private final MenuItemRepository menuItemRepository;
        private final StockAdjustmentRepository stockAdjustmentRepository;
        private final MenuItemMapper menuItemMapper;
        private final ApplicationEventPublisher eventPublisher;
        private final EntityManager entityManager;

        @Value("${comanda.stock.default-low-stock-alert:5}")
        private int defaultLowStockAlert = 5;

        @Override
        @Transactional
        public MenuItemResponse addStock(Long itemId, int quantity, String reason, UUID actorId) {
                requirePositive(quantity);
                MenuItem item = lockItem(itemId);
                if (!item.isTracked()) {
                        log.warn("Rejected stock add on untracked item: menuItemId={}, name='{}'", itemId,
                                        item.getName());
                        throw new InvalidInventoryOperationException("Cannot add stock to UNLIMITED items");
                }

                int oldStock = item.getStockQuantity();
                applyStockChange(item, increasedStock(item, oldStock, quantity), StockAdjustmentType.MANUAL_ADD,
                                reason, actorId, null);
                // a manual add only lifts the auto-block, not a deliberate switch-off
                if (oldStock == 0) {
                        reenableIfRestocked(item);
                }

                log.info("Stock added: menuItemId={}, name='{}', quantity={}, oldStock={}, newStock={}, by={}",
                                itemId, item.getName(), quantity, oldStock, item.getStockQuantity(), actorId);
                return menuItemMapper.toMenuItemResponse(item);
        }

        @Override
        @Transactional
        public MenuItemResponse removeStock(Long itemId, int quantity, String reason, UUID actorId) {
                requirePositive(quantity);
                MenuItem item = lockItem(itemId);
                if (!item.isTracked()) {
                        log.warn("Rejected stock removal on untracked item: menuItemId={}, name='{}'", itemId,
                                        item.getName());
                        throw new InvalidInventoryOperationException("Cannot remove stock from UNLIMITED items");
                }

                int oldStock = item.getStockQuantity();
                int newStock = oldStock - quantity;
                if (newStock < 0) {
                        log.warn("Insufficient stock to remove: menuItemId={}, stock={}, requested={}",
                                        itemId, oldStock, quantity);
                        throw new InsufficientStockException(
                                        String.format("Insufficient stock to remove from '%s'. Available: %d, Requested: %d",
                                                        item.getName(), oldStock, quantity),
                                        itemId);
                }

                applyStockChange(item, newStock, StockAdjustmentType.MANUAL_REMOVE, reason, actorId, null);
                blockIfDepleted(item, actorId, null);
                publishStockLevel(item, oldStock);

                log.info("Stock removed: menuItemId={}, name='{}', quantity={}, oldStock={}, newStock={}, by={}",
                                itemId, item.getName(), quantity, oldStock, newStock, actorId);
                return menuItemMapper.toMenuItemResponse(item);
        }

        @Override
        @Transactional
        public void deductStockForOrder(Long itemId, int quantity, UUID orderId) {
                requirePositive(quantity);
                MenuItem item = lockItem(itemId);
                if (!item.isTracked()) {
                        // switched to UNLIMITED after the order's pre-check, nothing to deduct
                        log.info("Skipping deduction for untracked item: menuItemId={}, orderId={}", itemId, orderId);
                        return;
                }

                int oldStock = item.getStockQuantity();
                if (oldStock < quantity) {
                        log.warn("Insufficient stock under lock: menuItemId={}, name='{}', stock={}, requested={}, orderId={}",
                                        itemId, item.getName(), oldStock, quantity, orderId);
                        throw new InsufficientStockException("Insufficient stock for " + item.getName(), itemId);
                }

                applyStockChange(item, oldStock - quantity, StockAdjustmentType.ORDER_DEDUCT,
                                "Order " + orderId, null, orderId);
                blockIfDepleted(item, null, orderId);
                publishStockLevel(item, oldStock);

                log.info("Stock deducted for order: menuItemId={}, quantity={}, oldStock={}, newStock={}, orderId={}",
                                itemId, quantity, oldStock, item.getStockQuantity(), orderId);
        }

        @Override
        @Transactional
        public void revertStockForOrder(Long itemId, int quantity, UUID orderId) {
                requirePositive(quantity);
                MenuItem item = lockItem(itemId);
                if (!item.isTracked()) {
                        log.info("Skipping reversion for untracked item: menuItemId={}, orderId={}", itemId, orderId);
                        return;
                }

                int oldStock = item.getStockQuantity();
                applyStockChange(item, increasedStock(item, oldStock, quantity), StockAdjustmentType.ORDER_CANCELLED,
                                "Order " + orderId + " cancelled", null, orderId);
                reenableIfRestocked(item);

                log.info("Stock reverted for cancelled order: menuItemId={}, quantity={}, oldStock={}, newStock={}, orderId={}",
                                itemId, quantity, oldStock, item.getStockQuantity(), orderId);
        }

        @Override
        @Transactional
        public List<MenuItemResponse> dailyStockReset(DailyResetRequest request, UUID actorId) {
                List<DailyResetItem> items = new ArrayList<>(request.getItems());
                items.sort(Comparator.comparing(DailyResetItem::getItemId));

                Set<Long> seen = new HashSet<>();
                for (DailyResetItem resetItem : items) {
                        if (!seen.add(resetItem.getItemId())) {
                                throw new IllegalArgumentException(
                                                "Item " + resetItem.getItemId() + " is listed more than once");
                        }
                }

                log.info("Daily stock reset started: itemCount={}, by={}", items.size(), actorId);

                List<MenuItemResponse> responses = new ArrayList<>();
                for (DailyResetItem resetItem : items) {
                        MenuItem item = lockItem(resetItem.getItemId());
                        if (!item.isTracked()) {
                                log.warn("Daily reset rejected for untracked item: menuItemId={}, name='{}'",
                                                item.getId(), item.getName());
                                // whole batch rolls back
                                throw new InvalidInventoryOperationException(
                                                "Cannot reset stock of UNLIMITED item: " + item.getName());
                        }

                        int oldStock = item.getStockQuantity();
                        int quantity = resetItem.getQuantity();

                        item.setInitialStock(quantity);
                        if (resetItem.getLowStockAlert() != null) {
                                item.setLowStockAlert(resetItem.getLowStockAlert());
                        } else if (item.getLowStockAlert() == null) {
                                item.setLowStockAlert(defaultLowStockAlert);
                        }
                        item.setIsAvailable(true);
                        applyStockChange(item, quantity, StockAdjustmentType.DAILY_RESET, DAILY_RESET_REASON,
                                        actorId, null);

                        log.info("Stock reset: menuItemId={}, name='{}', oldStock={}, newStock={}",
                                        item.getId(), item.getName(), oldStock, quantity);
                        responses.add(menuItemMapper.toMenuItemResponse(item));
                }

                log.info("Daily stock reset completed: itemCount={}", items.size());
                return responses;
        }

        @Override
        @Transactional
        public MenuItemResponse setInventoryType(Long itemId, InventoryTypeRequest request, UUID actorId) {
                MenuItem item = lockItem(itemId);
                InventoryType current = item.getInventoryType();
                InventoryType target = request.getInventoryType();

                if (current == InventoryType.TRACKED && target == InventoryType.UNLIMITED) {
                        item.setInventoryType(InventoryType.UNLIMITED);
                        item.setStockQuantity(null);
                        item.setInitialStock(null);
                        item.setLowStockAlert(null);

                } else if (current == InventoryType.UNLIMITED && target == InventoryType.TRACKED) {
                        int seed = request.getInitialStock() != null ? request.getInitialStock() : 0;
                        item.setInventoryType(InventoryType.TRACKED);
                        item.setInitialStock(seed);
                        item.setStockQuantity(0);
                        item.setLowStockAlert(request.getLowStockAlert() != null
                                        ? request.getLowStockAlert()
                                        : defaultLowStockAlert);
                        item.setAutoMarkUnavailable(true);
                        if (seed > 0) {
                                applyStockChange(item, seed, StockAdjustmentType.MANUAL_ADD,
                                                "Inventory tracking enabled", actorId, null);
                        } else {
                                blockIfDepleted(item, actorId, null);
                        }

                } else if (current == InventoryType.TRACKED && request.getLowStockAlert() != null) {
                        item.setLowStockAlert(request.getLowStockAlert());
                }

                log.info("Inventory type set: menuItemId={}, from={}, to={}, stock={}, lowStockAlert={}, by={}",
                                itemId, current, target, item.getStockQuantity(), item.getLowStockAlert(), actorId);
                return menuItemMapper.toMenuItemResponse(item);
        }

        @Override
        @Transactional(readOnly = true)
        public List<MenuItemResponse> findLowStock() {
                return menuItemRepository.findLowStock(InventoryType.TRACKED).stream()
                                .map(menuItemMapper::toMenuItemResponse)
                                .toList();
        }

        @Override
        @Transactional(readOnly = true)
        public List<MenuItemResponse> findOutOfStock() {
                return menuItemRepository.findByInventoryTypeAndStockQuantityOrderByNameAsc(InventoryType.TRACKED, 0)
                                .stream()
                                .map(menuItemMapper::toMenuItemResponse)
                                .toList();
        }

        @Override
        @Transactional(readOnly = true)
        public PageResponse<StockAdjustmentResponse> findHistory(Long itemId, int page, int limit) {
                if (page < 1) {
                        throw new IllegalArgumentException("Page must be at least 1");
                }
                if (limit < 1 || limit > MAX_PAGE_SIZE) {
                        throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE);
                }
                if (!menuItemRepository.existsById(itemId)) {
                        throw new ResourceNotFoundException("Menu item not found with id: " + itemId);
                }

                Page<StockAdjustment> result = stockAdjustmentRepository
                                .findByMenuItemIdOrderByCreatedAtDesc(itemId, PageRequest.of(page - 1, limit));

                return PageResponse.of(
                                result.getContent().stream()
                                                .map(menuItemMapper::toStockAdjustmentResponse)
                                                .toList(),
                                result.getTotalElements(), page, limit);
        }

        /**
         * Locks the item row and reloads its state. The refresh matters when the
         * entity is already in the persistence context: Hibernate takes the lock
         * but would otherwise keep the stale in-memory stock value.
         */
        private MenuItem lockItem(Long itemId) {
                MenuItem item = menuItemRepository.findByIdWithLock(itemId)
                                .orElseThrow(() -> {
                                        log.warn("Menu item not found: menuItemId={}", itemId);
                                        return new ResourceNotFoundException("Menu item not found with id: " + itemId);
                                });
                entityManager.refresh(item);
                return item;
        }

        private void applyStockChange(MenuItem item, int newStock, StockAdjustmentType type, String reason,
                        UUID actorId, UUID orderId) {
                int previous = item.getStockQuantity() != null ? item.getStockQuantity() : 0;
                item.setStockQuantity(newStock);
                recordAdjustment(item.getId(), type, previous, newStock, reason, actorId, orderId);
        }

        private void recordAdjustment(Long itemId, StockAdjustmentType type, int previous, int newStock,
                        String reason, UUID actorId, UUID orderId) {
                stockAdjustmentRepository.save(StockAdjustment.builder()
                                .menuItemId(itemId)
                                .adjustmentType(type)
                                .previousStock(previous)
                                .newStock(newStock)
                                .quantity(newStock - previous)
                                .reason(reason)
                                .userId(actorId)
                                .orderId(orderId)
                                .build());
        }

        private void blockIfDepleted(MenuItem item, UUID actorId, UUID orderId) {
                if (item.getStockQuantity() == 0
                                && Boolean.TRUE.equals(item.getAutoMarkUnavailable())
                                && Boolean.TRUE.equals(item.getIsAvailable())) {
                        item.setIsAvailable(false);
                        recordAdjustment(item.getId(), StockAdjustmentType.AUTO_BLOCKED, 0, 0,
                                        "Out of stock", actorId, orderId);
                        log.info("Menu item auto-marked unavailable: menuItemId={}, name='{}'", item.getId(),
                                        item.getName());
                }
        }

        private void reenableIfRestocked(MenuItem item) {
                if (item.getStockQuantity() > 0
                                && Boolean.TRUE.equals(item.getAutoMarkUnavailable())
                                && !Boolean.TRUE.equals(item.getIsAvailable())) {
                        item.setIsAvailable(true);
                        log.info("Menu item available again: menuItemId={}, name='{}', stock={}", item.getId(),
                                        item.getName(), item.getStockQuantity());
                }
        }

        // Alerts fire once, when the threshold (or zero) is crossed
        private void publishStockLevel(MenuItem item, int oldStock) {
                int newStock = item.getStockQuantity();
                if (newStock == 0 && oldStock > 0) {
                        eventPublisher.publishEvent(new StockLevelEvent(this, item, StockLevelEvent.DEPLETED));
                } else if (item.getLowStockAlert() != null
                                && newStock <= item.getLowStockAlert()
                                && oldStock > item.getLowStockAlert()) {
                        eventPublisher.publishEvent(new StockLevelEvent(this, item, StockLevelEvent.LOW));
                }
        }

        private int increasedStock(MenuItem item, int oldStock, int quantity) {
                try {
                        return Math.addExact(oldStock, quantity);
                } catch (ArithmeticException e) {
                        log.warn("Stock increase out of range: menuItemId={}, stock={}, quantity={}",
                                        item.getId(), oldStock, quantity);
                        throw new InvalidInventoryOperationException(
                                        String.format("Stock of '%s' cannot exceed %d", item.getName(), Integer.MAX_VALUE), e);
                }
        }

        private void requirePositive(int quantity) {
                if (quantity <= 0) {
                        throw new IllegalArgumentException("Quantity must be greater than 0");
                }
        }
}
