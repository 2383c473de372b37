package com.tradeerp.invoicing.service.ledger;

import com.tradeerp.invoicing.model.LedgerEntry;

public record DoubleEntry(LedgerEntry debitEntry, LedgerEntry creditEntry) {
}
