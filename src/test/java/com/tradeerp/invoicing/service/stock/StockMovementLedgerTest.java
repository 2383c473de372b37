package com.tradeerp.invoicing.service.stock;

import com.tradeerp.invoicing.config.ErpProperties;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.BatchInfo;
import com.tradeerp.invoicing.model.MovementType;
import com.tradeerp.invoicing.model.StockMovement;
import com.tradeerp.invoicing.model.StockReferenceType;
import com.tradeerp.invoicing.repository.ItemRepository;
import com.tradeerp.invoicing.repository.StockMovementRepository;
import com.tradeerp.invoicing.service.AuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StockMovementLedgerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 15, 12, 0);

    @Mock
    private StockMovementRepository movementRepository;
    @Mock
    private ItemRepository itemRepository;
    @Mock
    private AuditService auditService;

    private ErpProperties properties;
    private StockMovementLedger ledger;
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        properties = new ErpProperties();
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneId.of("UTC"));
        ledger = new StockMovementLedger(movementRepository, itemRepository, new StockMovementValidator(),
                auditService, properties, clock);
    }

    private void savesWithIds() {
        when(movementRepository.save(any(StockMovement.class))).thenAnswer(i -> {
            StockMovement m = i.getArgument(0);
            m.setId(ids.incrementAndGet());
            return m;
        });
    }

    private static StockMovement movement(long id, MovementType type, String qty, LocalDateTime at) {
        StockMovement m = new StockMovement();
        m.setId(id);
        m.setItemId(1L);
        m.setMovementType(type);
        m.setQuantity(new BigDecimal(qty));
        m.setReferenceType(StockReferenceType.PURCHASE_INVOICE);
        m.setReferenceId(9L);
        m.setMovementDate(at);
        m.setCreatedBy("alice");
        return m;
    }

    @Test
    void appendMovement_ShouldSaveAndAdjustCounterBySignedQuantity() {
        savesWithIds();
        when(itemRepository.adjustStock(1L, new BigDecimal("-4"))).thenReturn(new BigDecimal("6"));

        StockMovement saved = ledger.appendMovement(1L, MovementType.OUT, new BigDecimal("-4"),
                StockReferenceType.SALES_INVOICE, 7L, null, NOW, "Invoice SI2026000001", "alice");

        assertNotNull(saved.getId());
        assertEquals(MovementType.OUT, saved.getMovementType());
        assertEquals(new BigDecimal("-4"), saved.getQuantity());
        assertEquals(NOW, saved.getCreatedAt());
        verify(itemRepository).adjustStock(1L, new BigDecimal("-4"));
    }

    @Test
    void appendMovement_Backdated_ShouldStampCreationFromClock() {
        savesWithIds();
        when(itemRepository.adjustStock(1L, new BigDecimal("5"))).thenReturn(new BigDecimal("5"));

        StockMovement saved = ledger.appendMovement(1L, MovementType.IN, new BigDecimal("5"),
                StockReferenceType.PURCHASE_INVOICE, 7L, null, NOW.minusDays(3), null, "alice");

        assertEquals(NOW.minusDays(3), saved.getMovementDate());
        assertEquals(NOW, saved.getCreatedAt());
    }

    @Test
    void appendMovement_SignMismatch_ShouldFailWithoutSideEffects() {
        assertThrows(ValidationException.class, () -> ledger.appendMovement(1L, MovementType.IN,
                new BigDecimal("-1"), StockReferenceType.PURCHASE_INVOICE, 7L, null, NOW, null, "alice"));
        assertThrows(ValidationException.class, () -> ledger.appendMovement(1L, MovementType.OUT,
                new BigDecimal("1"), StockReferenceType.SALES_INVOICE, 7L, null, NOW, null, "alice"));

        verifyNoInteractions(itemRepository);
        verify(movementRepository, never()).save(any());
    }

    @Test
    void appendMovement_ZeroQuantity_ShouldFail() {
        ValidationException ex = assertThrows(ValidationException.class, () -> ledger.appendMovement(1L,
                MovementType.ADJUSTMENT, BigDecimal.ZERO, StockReferenceType.ADJUSTMENT, null, null, NOW, "x",
                "alice"));
        assertTrue(ex.getMessage().contains("zero"));
    }

    @Test
    void appendMovement_FutureDate_ShouldFail() {
        assertThrows(ValidationException.class, () -> ledger.appendMovement(1L, MovementType.IN, BigDecimal.ONE,
                StockReferenceType.PURCHASE_INVOICE, 7L, null, NOW.plusSeconds(1), null, "alice"));
    }

    @Test
    void appendMovement_ManufacturedAfterExpiry_ShouldFail() {
        BatchInfo batch = new BatchInfo("B1", LocalDate.of(2026, 1, 2), LocalDate.of(2026, 1, 1));

        assertThrows(ValidationException.class, () -> ledger.appendMovement(1L, MovementType.IN, BigDecimal.ONE,
                StockReferenceType.PURCHASE_INVOICE, 7L, batch, NOW, null, "alice"));
    }

    @Test
    void appendMovement_NegativeBalance_ShouldFailUnlessAllowed() {
        when(itemRepository.adjustStock(1L, new BigDecimal("-5"))).thenReturn(new BigDecimal("-2"));

        ValidationException ex = assertThrows(ValidationException.class, () -> ledger.appendMovement(1L,
                MovementType.OUT, new BigDecimal("-5"), StockReferenceType.SALES_INVOICE, 7L, null, NOW, null,
                "alice"));
        assertTrue(ex.getMessage().contains("Insufficient stock"));
        verify(movementRepository, never()).save(any());

        properties.getInventory().setAllowNegativeStock(true);
        savesWithIds();
        StockMovement saved = ledger.appendMovement(1L, MovementType.OUT, new BigDecimal("-5"),
                StockReferenceType.SALES_INVOICE, 7L, null, NOW, null, "alice");
        assertNotNull(saved.getId());
    }

    @Test
    void reverse_ShouldAppendExactNegationOfEachOriginal() {
        BatchInfo batch = new BatchInfo("B1", LocalDate.of(2024, 1, 1), LocalDate.of(2025, 12, 31));
        StockMovement first = movement(1, MovementType.IN, "10", NOW.minusDays(2));
        first.setBatchInfo(batch);
        StockMovement second = movement(2, MovementType.IN, "2.5", NOW.minusDays(2));
        second.setItemId(2L);
        when(movementRepository.findByReferenceTypeAndReferenceIdOrderByIdAsc(StockReferenceType.PURCHASE_INVOICE,
                9L)).thenReturn(List.of(first, second));
        when(itemRepository.adjustStock(any(), any())).thenReturn(BigDecimal.TEN);
        savesWithIds();

        List<StockMovement> reversals = ledger.reverse(StockReferenceType.PURCHASE_INVOICE, 9L, NOW, "bob");

        assertEquals(2, reversals.size());
        StockMovement r1 = reversals.get(0);
        assertEquals(MovementType.OUT, r1.getMovementType());
        assertEquals(new BigDecimal("-10"), r1.getQuantity());
        assertEquals(0, first.getQuantity().add(r1.getQuantity()).signum());
        assertEquals(1L, r1.getItemId());
        assertEquals(batch, r1.getBatchInfo());
        assertEquals(1L, r1.getReversalOfId());
        assertEquals(StockReferenceType.PURCHASE_INVOICE, r1.getReferenceType());
        assertEquals(9L, r1.getReferenceId());

        StockMovement r2 = reversals.get(1);
        assertEquals(2L, r2.getItemId());
        assertEquals(new BigDecimal("-2.5"), r2.getQuantity());

        // Originals untouched
        assertEquals(new BigDecimal("10"), first.getQuantity());
        assertNull(first.getReversalOfId());
        verify(itemRepository).adjustStock(1L, new BigDecimal("-10"));
        verify(itemRepository).adjustStock(2L, new BigDecimal("-2.5"));
    }

    @Test
    void reverse_ShouldSkipMovementsThatAreThemselvesReversals() {
        StockMovement original = movement(1, MovementType.IN, "3", NOW.minusDays(1));
        StockMovement earlierReversal = movement(2, MovementType.OUT, "-3", NOW.minusHours(1));
        earlierReversal.setReversalOfId(1L);
        when(movementRepository.findByReferenceTypeAndReferenceIdOrderByIdAsc(StockReferenceType.PURCHASE_INVOICE,
                9L)).thenReturn(List.of(original, earlierReversal));
        when(itemRepository.adjustStock(any(), any())).thenReturn(BigDecimal.ZERO);
        savesWithIds();

        List<StockMovement> reversals = ledger.reverse(StockReferenceType.PURCHASE_INVOICE, 9L, NOW, "bob");

        assertEquals(1, reversals.size());
        assertEquals(1L, reversals.get(0).getReversalOfId());
    }

    @Test
    void balanceAsOf_ShouldClampButRawBalanceShouldNot() {
        List<StockMovement> movements = List.of(
                movement(1, MovementType.IN, "5", NOW.minusDays(3)),
                movement(2, MovementType.OUT, "-8", NOW.minusDays(2)));
        when(movementRepository.findByItemIdAndMovementDateLessThanEqual(1L, NOW)).thenReturn(movements);

        assertEquals(0, ledger.balanceAsOf(1L, NOW).signum());
        assertEquals(0, new BigDecimal("-3").compareTo(ledger.rawBalanceAsOf(1L, NOW)));
    }

    @Test
    void balanceAsOf_ShouldNotDependOnInsertionOrder() {
        StockMovement a = movement(1, MovementType.IN, "10", NOW.minusDays(5));
        StockMovement b = movement(2, MovementType.OUT, "-4", NOW.minusDays(1));
        StockMovement c = movement(3, MovementType.ADJUSTMENT, "1.5", NOW.minusDays(3));
        when(movementRepository.findByItemIdAndMovementDateLessThanEqual(1L, NOW))
                .thenReturn(List.of(a, b, c))
                .thenReturn(List.of(b, c, a));

        BigDecimal first = ledger.balanceAsOf(1L, NOW);
        BigDecimal second = ledger.balanceAsOf(1L, NOW);

        assertEquals(0, new BigDecimal("7.5").compareTo(first));
        assertEquals(0, first.compareTo(second));
    }

    @Test
    void movementHistory_ShouldReplayInMovementDateOrderWithRunningBalance() {
        LocalDateTime from = NOW.minusDays(10);
        when(movementRepository.findByItemIdAndMovementDateLessThan(1L, from))
                .thenReturn(List.of(movement(1, MovementType.IN, "20", NOW.minusDays(30))));
        StockMovement late = movement(3, MovementType.OUT, "-5", NOW.minusDays(1));
        StockMovement early = movement(2, MovementType.IN, "3", NOW.minusDays(5));
        when(movementRepository.findByItemIdAndMovementDateBetween(1L, from, NOW))
                .thenReturn(new ArrayList<>(List.of(late, early)));

        List<MovementBalance> history = ledger.movementHistory(1L, from, NOW);

        assertEquals(2, history.size());
        assertEquals(2L, history.get(0).movement().getId());
        assertEquals(0, new BigDecimal("23").compareTo(history.get(0).runningBalance()));
        assertEquals(0, new BigDecimal("18").compareTo(history.get(1).runningBalance()));
    }

    @Test
    void recordCorrection_ShouldAppendDifferenceAsAdjustment() {
        when(itemRepository.findCurrentStock(1L)).thenReturn(Optional.of(new BigDecimal("10")));
        when(itemRepository.adjustStock(1L, new BigDecimal("-3"))).thenReturn(new BigDecimal("7"));
        savesWithIds();

        StockMovement movement = ledger.recordCorrection(1L, new BigDecimal("7"), "Cycle count", "alice");

        assertEquals(MovementType.ADJUSTMENT, movement.getMovementType());
        assertEquals(StockReferenceType.ADJUSTMENT, movement.getReferenceType());
        assertEquals(new BigDecimal("-3"), movement.getQuantity());
        assertEquals(NOW, movement.getMovementDate());
        verify(auditService).log(eq(AuditService.STOCK_ADJUSTED), anyString());
    }

    @Test
    void recordCorrection_NoDifference_ShouldFail() {
        when(itemRepository.findCurrentStock(1L)).thenReturn(Optional.of(new BigDecimal("7")));

        assertThrows(ValidationException.class,
                () -> ledger.recordCorrection(1L, new BigDecimal("7.000"), "Cycle count", "alice"));
        verify(movementRepository, never()).save(any());
    }

    @Test
    void recordAdjustment_WithoutReason_ShouldFail() {
        assertThrows(ValidationException.class,
                () -> ledger.recordAdjustment(1L, BigDecimal.ONE, " ", "alice"));
    }

    @Test
    void recordOpeningBalance_ShouldAppendInwardMovement() {
        when(itemRepository.adjustStock(1L, new BigDecimal("12"))).thenReturn(new BigDecimal("12"));
        savesWithIds();

        StockMovement movement = ledger.recordOpeningBalance(1L, new BigDecimal("12"), null, "alice");

        ArgumentCaptor<StockMovement> captor = ArgumentCaptor.forClass(StockMovement.class);
        verify(movementRepository).save(captor.capture());
        assertEquals(StockReferenceType.OPENING_BALANCE, captor.getValue().getReferenceType());
        assertEquals(MovementType.IN, movement.getMovementType());
    }
}
