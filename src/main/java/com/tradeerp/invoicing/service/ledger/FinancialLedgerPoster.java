package com.tradeerp.invoicing.service.ledger;

import com.tradeerp.invoicing.model.LedgerReferenceType;

import java.math.BigDecimal;

/**
 * Posting contract of the financial ledger. Both sides are written together or not at all, and the
 * amount must be positive.
 */
public interface FinancialLedgerPoster {

    DoubleEntry createDoubleEntry(PostingParty debitParty, PostingParty creditParty, BigDecimal amount,
            String description, LedgerReferenceType referenceType, Long referenceId, String userId);
}
