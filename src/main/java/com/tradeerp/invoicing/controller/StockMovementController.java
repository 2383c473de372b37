package com.tradeerp.invoicing.controller;

import com.tradeerp.invoicing.dto.MovementHistoryRow;
import com.tradeerp.invoicing.dto.StockAdjustmentRequest;
import com.tradeerp.invoicing.dto.StockBalanceView;
import com.tradeerp.invoicing.dto.StockCorrectionRequest;
import com.tradeerp.invoicing.model.StockMovement;
import com.tradeerp.invoicing.model.StockReferenceType;
import com.tradeerp.invoicing.service.stock.StockMovementLedger;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.security.Principal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/stock")
public class StockMovementController {

    private final StockMovementLedger stockLedger;
    private final Clock clock;

    public StockMovementController(StockMovementLedger stockLedger, Clock clock) {
        this.stockLedger = stockLedger;
        this.clock = clock;
    }

    @GetMapping("/items/{itemId}/balance")
    public StockBalanceView balance(@PathVariable Long itemId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf,
            @RequestParam(defaultValue = "false") boolean unclamped) {
        LocalDateTime at = asOf != null ? asOf : LocalDateTime.now(clock);
        BigDecimal balance = unclamped
                ? stockLedger.rawBalanceAsOf(itemId, at)
                : stockLedger.balanceAsOf(itemId, at);
        return new StockBalanceView(itemId, at, balance, !unclamped, stockLedger.currentStock(itemId));
    }

    @GetMapping("/items/{itemId}/history")
    public List<MovementHistoryRow> history(@PathVariable Long itemId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return stockLedger.movementHistory(itemId, from, to).stream()
                .map(MovementHistoryRow::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/movements")
    public List<StockMovement> byReference(@RequestParam StockReferenceType referenceType,
            @RequestParam Long referenceId) {
        return stockLedger.findByReference(referenceType, referenceId);
    }

    @GetMapping("/expired-batches")
    public List<StockMovement> expiredBatches(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return stockLedger.findExpiredBatches(asOf != null ? asOf : LocalDate.now(clock));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<StockMovement> adjust(@RequestBody StockAdjustmentRequest request, Principal principal) {
        StockMovement movement = stockLedger.recordAdjustment(request.getItemId(), request.getQuantity(),
                request.getReason(), principal.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(movement);
    }

    @PostMapping("/corrections")
    public ResponseEntity<StockMovement> correct(@RequestBody StockCorrectionRequest request, Principal principal) {
        StockMovement movement = stockLedger.recordCorrection(request.getItemId(), request.getActualStock(),
                request.getReason(), principal.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(movement);
    }
}
