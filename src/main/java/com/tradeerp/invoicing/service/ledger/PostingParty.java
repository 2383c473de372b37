package com.tradeerp.invoicing.service.ledger;

import com.tradeerp.invoicing.model.LedgerAccountType;

/**
 * One side of a double entry: a customer, a supplier or a general ledger account.
 */
public record PostingParty(LedgerAccountType accountType, Long accountId) {

    public static PostingParty customer(Long customerId) {
        return new PostingParty(LedgerAccountType.CUSTOMER, customerId);
    }

    public static PostingParty supplier(Long supplierId) {
        return new PostingParty(LedgerAccountType.SUPPLIER, supplierId);
    }

    public static PostingParty account(Long accountId) {
        return new PostingParty(LedgerAccountType.ACCOUNT, accountId);
    }
}
