package com.comanda.orderservice.service;

import com.comanda.common.exception.InsufficientStockException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.TestFixtures;
import com.comanda.orderservice.dto.DailyResetItem;
import com.comanda.orderservice.dto.DailyResetRequest;
import com.comanda.orderservice.dto.InventoryTypeRequest;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StockService Unit Tests")
class StockServiceImplTest {

    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private StockAdjustmentRepository stockAdjustmentRepository;
    @Mock
    private MenuItemMapper menuItemMapper;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private EntityManager entityManager;

    @InjectMocks
    private StockServiceImpl stockService;

    private UUID actorId;
    private UUID orderId;
    private MenuItem flan;
    private MenuItem coffee;

    @BeforeEach
    void setUp() {
        actorId = UUID.randomUUID();
        orderId = UUID.randomUUID();

        // threshold 2
        flan = TestFixtures.trackedItem("Flan", "4000.00", 10);
        flan.setId(1L);
        coffee = TestFixtures.unlimitedItem("Coffee", "3000.00");
        coffee.setId(2L);
    }

    private void givenLocked(MenuItem item) {
        when(menuItemRepository.findByIdWithLock(item.getId())).thenReturn(Optional.of(item));
    }

    private List<StockAdjustment> savedAdjustments(int expected) {
        ArgumentCaptor<StockAdjustment> captor = ArgumentCaptor.forClass(StockAdjustment.class);
        verify(stockAdjustmentRepository, times(expected)).save(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("Manual adjustments")
    class ManualAdjustmentTests {

        @Test
        @DisplayName("should add stock and record a MANUAL_ADD row")
        void shouldAddStock() {
            givenLocked(flan);

            stockService.addStock(1L, 5, "Supplier delivery", actorId);

            assertThat(flan.getStockQuantity()).isEqualTo(15);
            verify(entityManager).refresh(flan);
            StockAdjustment adjustment = savedAdjustments(1).get(0);
            assertThat(adjustment.getAdjustmentType()).isEqualTo(StockAdjustmentType.MANUAL_ADD);
            assertThat(adjustment.getPreviousStock()).isEqualTo(10);
            assertThat(adjustment.getNewStock()).isEqualTo(15);
            assertThat(adjustment.getQuantity()).isEqualTo(5);
            assertThat(adjustment.getUserId()).isEqualTo(actorId);
            assertThat(adjustment.getReason()).isEqualTo("Supplier delivery");
        }

        @Test
        @DisplayName("should re-enable an auto-blocked item when stock comes back")
        void shouldReenableOnAdd() {
            flan.setStockQuantity(0);
            flan.setIsAvailable(false);
            givenLocked(flan);

            stockService.addStock(1L, 3, null, actorId);

            assertThat(flan.getIsAvailable()).isTrue();
        }

        @Test
        @DisplayName("should not re-enable an item switched off while it still had stock")
        void shouldNotReenableWhenNotDepleted() {
            flan.setIsAvailable(false);
            givenLocked(flan);

            stockService.addStock(1L, 3, null, actorId);

            assertThat(flan.getStockQuantity()).isEqualTo(13);
            assertThat(flan.getIsAvailable()).isFalse();
        }

        @Test
        @DisplayName("should reject an add that would overflow the stock counter")
        void shouldRejectOverflowingAdd() {
            givenLocked(flan);

            assertThatThrownBy(() -> stockService.addStock(1L, Integer.MAX_VALUE, "Supplier delivery", actorId))
                    .isInstanceOf(InvalidInventoryOperationException.class)
                    .hasCauseInstanceOf(ArithmeticException.class);

            assertThat(flan.getStockQuantity()).isEqualTo(10);
            verifyNoInteractions(stockAdjustmentRepository);
        }

        @Test
        @DisplayName("should leave a manually disabled item alone when auto-marking is off")
        void shouldNotReenableWhenAutoMarkOff() {
            flan.setStockQuantity(0);
            flan.setIsAvailable(false);
            flan.setAutoMarkUnavailable(false);
            givenLocked(flan);

            stockService.addStock(1L, 3, null, actorId);

            assertThat(flan.getIsAvailable()).isFalse();
        }

        @Test
        @DisplayName("should reject manual changes on UNLIMITED items")
        void shouldRejectUnlimited() {
            givenLocked(coffee);

            assertThatThrownBy(() -> stockService.addStock(2L, 5, null, actorId))
                    .isInstanceOf(InvalidInventoryOperationException.class);
            assertThatThrownBy(() -> stockService.removeStock(2L, 5, null, actorId))
                    .isInstanceOf(InvalidInventoryOperationException.class);

            verify(stockAdjustmentRepository, never()).save(any());
        }

        @Test
        @DisplayName("should reject removal below zero")
        void shouldRejectRemovalBelowZero() {
            givenLocked(flan);

            assertThatThrownBy(() -> stockService.removeStock(1L, 11, null, actorId))
                    .isInstanceOf(InsufficientStockException.class)
                    .satisfies(e -> assertThat(((InsufficientStockException) e).getMenuItemId()).isEqualTo(1L));

            assertThat(flan.getStockQuantity()).isEqualTo(10);
            verify(stockAdjustmentRepository, never()).save(any());
        }

        @Test
        @DisplayName("should reject non-positive quantity before touching the row")
        void shouldRejectNonPositiveQuantity() {
            assertThatThrownBy(() -> stockService.addStock(1L, 0, null, actorId))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(menuItemRepository);
        }

        @Test
        @DisplayName("should fail for unknown item")
        void shouldFailForUnknownItem() {
            when(menuItemRepository.findByIdWithLock(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> stockService.addStock(99L, 1, null, actorId))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Order deduction and reversion")
    class OrderLedgerTests {

        @Test
        @DisplayName("should deduct and auto-block when stock reaches zero")
        void shouldDeductAndBlockAtZero() {
            flan.setStockQuantity(3);
            givenLocked(flan);

            stockService.deductStockForOrder(1L, 3, orderId);

            assertThat(flan.getStockQuantity()).isZero();
            assertThat(flan.getIsAvailable()).isFalse();

            List<StockAdjustment> rows = savedAdjustments(2);
            assertThat(rows.get(0).getAdjustmentType()).isEqualTo(StockAdjustmentType.ORDER_DEDUCT);
            assertThat(rows.get(0).getQuantity()).isEqualTo(-3);
            assertThat(rows.get(0).getOrderId()).isEqualTo(orderId);
            assertThat(rows.get(0).getReason()).isEqualTo("Order " + orderId);
            assertThat(rows.get(1).getAdjustmentType()).isEqualTo(StockAdjustmentType.AUTO_BLOCKED);
            assertThat(rows.get(1).getQuantity()).isZero();

            ArgumentCaptor<StockLevelEvent> eventCaptor = ArgumentCaptor.forClass(StockLevelEvent.class);
            verify(eventPublisher).publishEvent(eventCaptor.capture());
            assertThat(eventCaptor.getValue().getRoutingKey()).isEqualTo(StockLevelEvent.DEPLETED);
        }

        @Test
        @DisplayName("should re-check sufficiency under the lock")
        void shouldRecheckUnderLock() {
            flan.setStockQuantity(2);
            givenLocked(flan);

            assertThatThrownBy(() -> stockService.deductStockForOrder(1L, 3, orderId))
                    .isInstanceOf(InsufficientStockException.class)
                    .hasMessage("Insufficient stock for Flan");

            assertThat(flan.getStockQuantity()).isEqualTo(2);
            verifyNoInteractions(stockAdjustmentRepository, eventPublisher);
        }

        @Test
        @DisplayName("should publish low stock alert when crossing the threshold")
        void shouldPublishLowStockAlert() {
            givenLocked(flan);

            stockService.deductStockForOrder(1L, 8, orderId);

            ArgumentCaptor<StockLevelEvent> eventCaptor = ArgumentCaptor.forClass(StockLevelEvent.class);
            verify(eventPublisher).publishEvent(eventCaptor.capture());
            assertThat(eventCaptor.getValue().getRoutingKey()).isEqualTo(StockLevelEvent.LOW);
            assertThat(flan.getIsAvailable()).isTrue();
        }

        @Test
        @DisplayName("should stay quiet while stock is already below the threshold")
        void shouldNotRepeatLowStockAlert() {
            flan.setStockQuantity(2);
            givenLocked(flan);

            stockService.deductStockForOrder(1L, 1, orderId);

            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("should skip items that stopped being tracked")
        void shouldSkipUntrackedItems() {
            givenLocked(coffee);

            stockService.deductStockForOrder(2L, 4, orderId);
            stockService.revertStockForOrder(2L, 4, orderId);

            verifyNoInteractions(stockAdjustmentRepository);
            assertThat(coffee.getStockQuantity()).isNull();
        }

        @Test
        @DisplayName("should reject a reversion that would overflow the stock counter")
        void shouldRejectOverflowingRevert() {
            flan.setStockQuantity(Integer.MAX_VALUE - 1);
            givenLocked(flan);

            assertThatThrownBy(() -> stockService.revertStockForOrder(1L, 2, orderId))
                    .isInstanceOf(InvalidInventoryOperationException.class);

            assertThat(flan.getStockQuantity()).isEqualTo(Integer.MAX_VALUE - 1);
            verifyNoInteractions(stockAdjustmentRepository);
        }

        @Test
        @DisplayName("should revert a cancelled line and re-enable the item")
        void shouldRevertCancelledLine() {
            flan.setStockQuantity(0);
            flan.setIsAvailable(false);
            givenLocked(flan);

            stockService.revertStockForOrder(1L, 4, orderId);

            assertThat(flan.getStockQuantity()).isEqualTo(4);
            assertThat(flan.getIsAvailable()).isTrue();
            StockAdjustment row = savedAdjustments(1).get(0);
            assertThat(row.getAdjustmentType()).isEqualTo(StockAdjustmentType.ORDER_CANCELLED);
            assertThat(row.getQuantity()).isEqualTo(4);
            assertThat(row.getReason()).isEqualTo("Order " + orderId + " cancelled");
        }
    }

    @Nested
    @DisplayName("Daily reset")
    class DailyResetTests {

        @Test
        @DisplayName("should lock items in ascending id order")
        void shouldLockInAscendingOrder() {
            MenuItem pie = TestFixtures.trackedItem("Pie", "5000.00", 1);
            pie.setId(7L);
            givenLocked(flan);
            givenLocked(pie);

            DailyResetRequest request = new DailyResetRequest(List.of(
                    new DailyResetItem(7L, 20, null),
                    new DailyResetItem(1L, 30, 4)));

            stockService.dailyStockReset(request, actorId);

            var inOrder = inOrder(menuItemRepository);
            inOrder.verify(menuItemRepository).findByIdWithLock(1L);
            inOrder.verify(menuItemRepository).findByIdWithLock(7L);

            assertThat(flan.getStockQuantity()).isEqualTo(30);
            assertThat(flan.getInitialStock()).isEqualTo(30);
            assertThat(flan.getLowStockAlert()).isEqualTo(4);
            assertThat(pie.getStockQuantity()).isEqualTo(20);
            assertThat(pie.getLowStockAlert()).isEqualTo(2);
            assertThat(savedAdjustments(2)).allMatch(a -> a.getAdjustmentType() == StockAdjustmentType.DAILY_RESET);
        }

        @Test
        @DisplayName("should reject duplicate items before locking anything")
        void shouldRejectDuplicates() {
            DailyResetRequest request = new DailyResetRequest(List.of(
                    new DailyResetItem(1L, 20, null),
                    new DailyResetItem(1L, 30, null)));

            assertThatThrownBy(() -> stockService.dailyStockReset(request, actorId))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(menuItemRepository);
        }

        @Test
        @DisplayName("should reject UNLIMITED items")
        void shouldRejectUnlimited() {
            givenLocked(coffee);
            DailyResetRequest request = new DailyResetRequest(List.of(new DailyResetItem(2L, 20, null)));

            assertThatThrownBy(() -> stockService.dailyStockReset(request, actorId))
                    .isInstanceOf(InvalidInventoryOperationException.class);
        }
    }

    @Nested
    @DisplayName("Inventory type")
    class InventoryTypeTests {

        @Test
        @DisplayName("should clear stock fields when switching to UNLIMITED")
        void shouldClearStockFields() {
            givenLocked(flan);

            stockService.setInventoryType(1L, new InventoryTypeRequest(InventoryType.UNLIMITED, null, null), actorId);

            assertThat(flan.getInventoryType()).isEqualTo(InventoryType.UNLIMITED);
            assertThat(flan.getStockQuantity()).isNull();
            assertThat(flan.getInitialStock()).isNull();
            assertThat(flan.getLowStockAlert()).isNull();
            verifyNoInteractions(stockAdjustmentRepository);
        }

        @Test
        @DisplayName("should seed stock with a MANUAL_ADD row when switching to TRACKED")
        void shouldSeedStock() {
            givenLocked(coffee);

            stockService.setInventoryType(2L, new InventoryTypeRequest(InventoryType.TRACKED, 3, 12), actorId);

            assertThat(coffee.getInventoryType()).isEqualTo(InventoryType.TRACKED);
            assertThat(coffee.getStockQuantity()).isEqualTo(12);
            assertThat(coffee.getInitialStock()).isEqualTo(12);
            assertThat(coffee.getLowStockAlert()).isEqualTo(3);
            StockAdjustment row = savedAdjustments(1).get(0);
            assertThat(row.getAdjustmentType()).isEqualTo(StockAdjustmentType.MANUAL_ADD);
            assertThat(row.getPreviousStock()).isZero();
            assertThat(row.getQuantity()).isEqualTo(12);
        }

        @Test
        @DisplayName("should default the threshold and block the item without a seed")
        void shouldDefaultThresholdAndBlock() {
            givenLocked(coffee);

            stockService.setInventoryType(2L, new InventoryTypeRequest(InventoryType.TRACKED, null, null), actorId);

            assertThat(coffee.getStockQuantity()).isZero();
            assertThat(coffee.getLowStockAlert()).isEqualTo(5);
            assertThat(coffee.getIsAvailable()).isFalse();
            StockAdjustment row = savedAdjustments(1).get(0);
            assertThat(row.getAdjustmentType()).isEqualTo(StockAdjustmentType.AUTO_BLOCKED);
            assertThat(row.getQuantity()).isZero();
            assertThat(row.getUserId()).isEqualTo(actorId);
        }

        @Test
        @DisplayName("should only update the threshold of an already tracked item")
        void shouldUpdateThresholdOnly() {
            givenLocked(flan);

            stockService.setInventoryType(1L, new InventoryTypeRequest(InventoryType.TRACKED, 6, 99), actorId);

            assertThat(flan.getStockQuantity()).isEqualTo(10);
            assertThat(flan.getLowStockAlert()).isEqualTo(6);
            verifyNoInteractions(stockAdjustmentRepository);
        }
    }

    @Nested
    @DisplayName("History")
    class HistoryTests {

        @Test
        @DisplayName("should validate paging before querying")
        void shouldValidatePaging() {
            assertThatThrownBy(() -> stockService.findHistory(1L, 0, 20))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> stockService.findHistory(1L, 1, 101))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(menuItemRepository, stockAdjustmentRepository);
        }

        @Test
        @DisplayName("should fail for unknown item")
        void shouldFailForUnknownItem() {
            when(menuItemRepository.existsById(99L)).thenReturn(false);

            assertThatThrownBy(() -> stockService.findHistory(99L, 1, 20))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
