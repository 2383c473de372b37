package com.tradeerp.invoicing.service.stock;

import com.tradeerp.invoicing.config.ErpProperties;
import com.tradeerp.invoicing.exception.NotFoundException;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.BatchInfo;
import com.tradeerp.invoicing.model.MovementType;
import com.tradeerp.invoicing.model.StockMovement;
import com.tradeerp.invoicing.model.StockReferenceType;
import com.tradeerp.invoicing.repository.ItemRepository;
import com.tradeerp.invoicing.repository.StockMovementRepository;
import com.tradeerp.invoicing.service.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only stock ledger. Every append also applies the signed quantity to the item's running
 * counter, inside the caller's transaction, so the movement row and the counter change commit together.
 * <p>
 * The ledger trusts its callers about reversals: {@link #reverse} appends a negation for every original
 * movement of the reference each time it is called. Invoice status is what keeps it to once.
 */
@Service
public class StockMovementLedger {

    private static final Logger logger = LoggerFactory.getLogger(StockMovementLedger.class);

    private static final Comparator<StockMovement> REPLAY_ORDER = Comparator
            .comparing(StockMovement::getMovementDate)
            .thenComparing(StockMovement::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final StockMovementRepository movementRepository;
    private final ItemRepository itemRepository;
    private final StockMovementValidator validator;
    private final AuditService auditService;
    private final ErpProperties properties;
    private final Clock clock;

    public StockMovementLedger(StockMovementRepository movementRepository, ItemRepository itemRepository,
            StockMovementValidator validator, AuditService auditService, ErpProperties properties, Clock clock) {
        this.movementRepository = movementRepository;
        this.itemRepository = itemRepository;
        this.validator = validator;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public StockMovement appendMovement(Long itemId, MovementType type, BigDecimal signedQuantity,
            StockReferenceType referenceType, Long referenceId, BatchInfo batchInfo, LocalDateTime movementDate,
            String notes, String userId) {
        StockMovement movement = new StockMovement();
        movement.setItemId(itemId);
        movement.setMovementType(type);
        movement.setQuantity(signedQuantity);
        movement.setReferenceType(referenceType);
        movement.setReferenceId(referenceId);
        movement.setBatchInfo(batchInfo == null || batchInfo.isEmpty() ? null : batchInfo.copy());
        movement.setMovementDate(movementDate);
        movement.setNotes(notes);
        movement.setCreatedBy(userId);
        return append(movement);
    }

    private StockMovement append(StockMovement movement) {
        LocalDateTime now = LocalDateTime.now(clock);
        validator.validate(movement, now);
        if (movement.getCreatedBy() == null || movement.getCreatedBy().isBlank()) {
            throw new ValidationException("User is required", "createdBy");
        }

        BigDecimal newBalance = itemRepository.adjustStock(movement.getItemId(), movement.getQuantity());
        if (movement.getQuantity().signum() < 0 && newBalance.signum() < 0
                && !properties.getInventory().isAllowNegativeStock()) {
            throw new ValidationException("Insufficient stock for item " + movement.getItemId()
                    + ": balance would be " + newBalance.stripTrailingZeros().toPlainString(), "quantity");
        }

        movement.setCreatedAt(now);
        StockMovement saved = movementRepository.save(movement);
        logger.debug("Stock {} {} for item {} ({} #{}), balance {}", saved.getMovementType(), saved.getQuantity(),
                saved.getItemId(), saved.getReferenceType(), saved.getReferenceId(), newBalance);
        return saved;
    }

    /**
     * Appends, for every original movement of the reference, a movement of the opposite type with the
     * exact negated quantity, the same item and the same batch. Originals are left untouched.
     *
     * @return the appended reversal movements, in the order of the originals
     */
    @Transactional
    public List<StockMovement> reverse(StockReferenceType referenceType, Long referenceId, LocalDateTime at,
            String userId) {
        List<StockMovement> originals = new ArrayList<>(
                movementRepository.findByReferenceTypeAndReferenceIdOrderByIdAsc(referenceType, referenceId));
        originals.removeIf(m -> m.getReversalOfId() != null);

        List<StockMovement> reversals = new ArrayList<>(originals.size());
        for (StockMovement original : originals) {
            StockMovement reversal = new StockMovement();
            reversal.setItemId(original.getItemId());
            reversal.setMovementType(original.getMovementType().opposite());
            reversal.setQuantity(original.getQuantity().negate());
            reversal.setReferenceType(original.getReferenceType());
            reversal.setReferenceId(original.getReferenceId());
            reversal.setBatchInfo(original.getBatchInfo() == null ? null : original.getBatchInfo().copy());
            reversal.setMovementDate(at);
            reversal.setNotes("Reversal of movement #" + original.getId());
            reversal.setReversalOfId(original.getId());
            reversal.setCreatedBy(userId);
            reversals.add(append(reversal));
        }
        logger.info("Reversed {} movement(s) for {} #{}", reversals.size(), referenceType, referenceId);
        return reversals;
    }

    @Transactional
    public StockMovement recordAdjustment(Long itemId, BigDecimal signedQuantity, String reason, String userId) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required for stock adjustments", "reason");
        }
        StockMovement movement = appendMovement(itemId, MovementType.ADJUSTMENT, signedQuantity,
                StockReferenceType.ADJUSTMENT, null, null, LocalDateTime.now(clock), reason, userId);
        auditService.log(AuditService.STOCK_ADJUSTED,
                "Item " + itemId + " adjusted by " + signedQuantity.toPlainString() + ": " + reason);
        logger.info("Stock adjustment of {} recorded for item {}", signedQuantity, itemId);
        return movement;
    }

    /**
     * Records the adjustment that brings the running counter to a physically counted quantity.
     */
    @Transactional
    public StockMovement recordCorrection(Long itemId, BigDecimal actualStock, String reason, String userId) {
        if (actualStock == null || actualStock.signum() < 0) {
            throw new ValidationException("Counted stock cannot be negative", "actualStock");
        }
        BigDecimal delta = actualStock.subtract(currentStock(itemId));
        if (delta.signum() == 0) {
            throw new ValidationException("Stock already matches the counted quantity", "actualStock");
        }
        return recordAdjustment(itemId, delta, reason, userId);
    }

    @Transactional
    public StockMovement recordOpeningBalance(Long itemId, BigDecimal quantity, BatchInfo batchInfo, String userId) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Opening balance must be positive", "quantity");
        }
        return appendMovement(itemId, MovementType.IN, quantity, StockReferenceType.OPENING_BALANCE, null,
                batchInfo, LocalDateTime.now(clock), "Opening balance", userId);
    }

    /**
     * Balance replayed from the ledger, floored at zero for reporting.
     */
    @Transactional(readOnly = true)
    public BigDecimal balanceAsOf(Long itemId, LocalDateTime asOf) {
        return rawBalanceAsOf(itemId, asOf).max(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public BigDecimal rawBalanceAsOf(Long itemId, LocalDateTime asOf) {
        return replay(movementRepository.findByItemIdAndMovementDateLessThanEqual(itemId, asOf));
    }

    @Transactional(readOnly = true)
    public BigDecimal currentStock(Long itemId) {
        return itemRepository.findCurrentStock(itemId)
                .orElseThrow(() -> new NotFoundException("Item not found: " + itemId));
    }

    @Transactional(readOnly = true)
    public List<MovementBalance> movementHistory(Long itemId, LocalDateTime from, LocalDateTime to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("History start must not be after its end", "from");
        }
        LocalDateTime end = to != null ? to : LocalDateTime.now(clock);
        LocalDateTime start = from != null ? from : LocalDateTime.of(1970, 1, 1, 0, 0);

        BigDecimal running = replay(movementRepository.findByItemIdAndMovementDateLessThan(itemId, start));
        List<StockMovement> movements = new ArrayList<>(
                movementRepository.findByItemIdAndMovementDateBetween(itemId, start, end));
        movements.sort(REPLAY_ORDER);

        List<MovementBalance> history = new ArrayList<>(movements.size());
        for (StockMovement movement : movements) {
            running = running.add(movement.getQuantity());
            history.add(new MovementBalance(movement, running));
        }
        return history;
    }

    @Transactional(readOnly = true)
    public List<StockMovement> findByReference(StockReferenceType referenceType, Long referenceId) {
        return movementRepository.findByReferenceTypeAndReferenceIdOrderByIdAsc(referenceType, referenceId);
    }

    /**
     * Inward movements whose batch expired before {@code asOf}.
     */
    @Transactional(readOnly = true)
    public List<StockMovement> findExpiredBatches(LocalDate asOf) {
        return movementRepository.findInwardMovementsExpiredBefore(asOf);
    }

    private static BigDecimal replay(List<StockMovement> movements) {
        List<StockMovement> ordered = new ArrayList<>(movements);
        ordered.sort(REPLAY_ORDER);
        BigDecimal balance = BigDecimal.ZERO;
        for (StockMovement movement : ordered) {
            balance = balance.add(movement.getQuantity());
        }
        return balance;
    }
}
