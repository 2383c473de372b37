package com.tradeerp.invoicing.service.ledger;

import com.tradeerp.invoicing.model.CounterpartyKind;
import com.tradeerp.invoicing.model.Invoice;
import com.tradeerp.invoicing.model.InvoiceType;
import com.tradeerp.invoicing.model.LedgerReferenceType;
import com.tradeerp.invoicing.model.Payment;
import com.tradeerp.invoicing.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Decides which parties an invoice or payment posts against and hands the entry to the
 * {@link FinancialLedgerPoster}.
 * <p>
 * Goods going out (sales, purchase returns) debit the counterparty and credit the trading account;
 * goods coming in do the reverse. Cash settles the counterparty in the opposite direction.
 * Zero amounts are not posted.
 */
@Component
public class InvoicePostingRules {

    private static final Logger logger = LoggerFactory.getLogger(InvoicePostingRules.class);

    private final FinancialLedgerPoster poster;
    private final SettingsService settingsService;

    public InvoicePostingRules(FinancialLedgerPoster poster, SettingsService settingsService) {
        this.poster = poster;
        this.settingsService = settingsService;
    }

    public Optional<DoubleEntry> postConfirmation(Invoice invoice, String userId) {
        return postInvoice(invoice, false, "Invoice " + invoice.getInvoiceNumber() + " confirmed", userId);
    }

    // Mirror of the confirmation entry
    public Optional<DoubleEntry> postCancellation(Invoice invoice, String userId) {
        return postInvoice(invoice, true, "Invoice " + invoice.getInvoiceNumber() + " cancelled", userId);
    }

    public Optional<DoubleEntry> postPayment(Invoice invoice, Payment payment, String userId) {
        if (payment.getAmount().signum() == 0) {
            return Optional.empty();
        }
        PostingParty party = counterparty(invoice);
        PostingParty cash = PostingParty.account(settingsService.getCashAccountId());
        String description = "Payment for invoice " + invoice.getInvoiceNumber();

        if (invoice.getType().isGoodsOutward()) {
            return Optional.of(poster.createDoubleEntry(cash, party, payment.getAmount(), description,
                    LedgerReferenceType.PAYMENT, payment.getId(), userId));
        }
        return Optional.of(poster.createDoubleEntry(party, cash, payment.getAmount(), description,
                LedgerReferenceType.PAYMENT, payment.getId(), userId));
    }

    private Optional<DoubleEntry> postInvoice(Invoice invoice, boolean mirror, String description, String userId) {
        BigDecimal amount = invoice.getTotals().getGrandTotal();
        if (amount == null || amount.signum() == 0) {
            logger.info("Skipping ledger posting for zero-value invoice {}", invoice.getInvoiceNumber());
            return Optional.empty();
        }
        PostingParty party = counterparty(invoice);
        PostingParty trading = tradingAccount(invoice.getType());

        PostingParty debit = invoice.getType().isGoodsOutward() ? party : trading;
        PostingParty credit = invoice.getType().isGoodsOutward() ? trading : party;
        if (mirror) {
            PostingParty swap = debit;
            debit = credit;
            credit = swap;
        }
        return Optional.of(poster.createDoubleEntry(debit, credit, amount, description,
                LedgerReferenceType.INVOICE, invoice.getId(), userId));
    }

    private PostingParty tradingAccount(InvoiceType type) {
        if (type == InvoiceType.SALES || type == InvoiceType.RETURN_SALES) {
            return PostingParty.account(settingsService.getSalesAccountId());
        }
        return PostingParty.account(settingsService.getPurchaseAccountId());
    }

    private static PostingParty counterparty(Invoice invoice) {
        if (invoice.getType().getCounterpartyKind() == CounterpartyKind.CUSTOMER) {
            return PostingParty.customer(invoice.getCustomerId());
        }
        return PostingParty.supplier(invoice.getSupplierId());
    }
}
