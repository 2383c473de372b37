package com.tradeerp.invoicing.service.ledger;

import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.LedgerEntry;
import com.tradeerp.invoicing.model.LedgerReferenceType;
import com.tradeerp.invoicing.model.LedgerTransactionType;
import com.tradeerp.invoicing.repository.LedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes both legs into ledger_entries. Must run inside the caller's transaction so a posting never
 * outlives the stock change it accompanies.
 */
@Service
public class JpaFinancialLedgerPoster implements FinancialLedgerPoster {

    private static final Logger logger = LoggerFactory.getLogger(JpaFinancialLedgerPoster.class);

    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    public JpaFinancialLedgerPoster(LedgerEntryRepository ledgerEntryRepository, Clock clock) {
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public DoubleEntry createDoubleEntry(PostingParty debitParty, PostingParty creditParty, BigDecimal amount,
            String description, LedgerReferenceType referenceType, Long referenceId, String userId) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Ledger posting amount must be positive", "amount");
        }
        if (debitParty == null || creditParty == null
                || debitParty.accountId() == null || creditParty.accountId() == null) {
            throw new ValidationException("Both ledger parties are required");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LedgerEntry debit = ledgerEntryRepository.save(
                entry(debitParty, LedgerTransactionType.DEBIT, amount, description, referenceType, referenceId,
                        now, userId));
        LedgerEntry credit = ledgerEntryRepository.save(
                entry(creditParty, LedgerTransactionType.CREDIT, amount, description, referenceType, referenceId,
                        now, userId));

        logger.debug("Posted {} {}#{} -> {}#{} for {} #{}", amount, debitParty.accountType(),
                debitParty.accountId(), creditParty.accountType(), creditParty.accountId(), referenceType,
                referenceId);
        return new DoubleEntry(debit, credit);
    }

    private static LedgerEntry entry(PostingParty party, LedgerTransactionType side, BigDecimal amount,
            String description, LedgerReferenceType referenceType, Long referenceId, LocalDateTime at,
            String userId) {
        LedgerEntry entry = new LedgerEntry();
        entry.setAccountId(party.accountId());
        entry.setAccountType(party.accountType());
        entry.setTransactionType(side);
        entry.setAmount(amount);
        entry.setDescription(description);
        entry.setReferenceType(referenceType);
        entry.setReferenceId(referenceId);
        entry.setTransactionDate(at);
        entry.setCreatedBy(userId);
        return entry;
    }
}
