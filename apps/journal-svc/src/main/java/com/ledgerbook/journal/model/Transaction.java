package com.ledgerbook.journal.model;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * One receivable or payable ledger line. Optional fields are {@code null} when absent.
 */
public record Transaction(
        long id,
        LocalDate entryDate,
        long categoryId,
        BigDecimal amount,
        BigDecimal pretaxAmount,
        TransactionType type,
        TransactionStatus status,
        YearMonth monthDue,
        YearMonth monthPaid,
        LocalDate dateProcessed,
        YearMonth paymentForMonth,
        String notes
) {

    public Transaction {
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        if (type == null) {
            throw new IllegalArgumentException("transaction type must be provided");
        }
        if (status == null) {
            status = TransactionStatus.PENDING;
        }
        if (!status.validFor(type)) {
            throw new IllegalArgumentException("status " + status + " is not valid for a " + type + " transaction");
        }
        if (status.settled() && monthPaid == null) {
            throw new IllegalArgumentException("month paid is required once a transaction is " + status);
        }
        amount = Money.round(amount);
        pretaxAmount = pretaxAmount == null ? null : Money.round(pretaxAmount);
    }

    public boolean receivable() {
        return type == TransactionType.RECEIVABLE;
    }

    public boolean payable() {
        return type == TransactionType.PAYABLE;
    }

    /** Amount recognised as revenue: the pre-tax amount when recorded, otherwise the full amount. */
    public BigDecimal revenueAmount() {
        return pretaxAmount != null ? pretaxAmount : amount;
    }

    /**
     * True while the transaction is still open at the end of {@code asOf}: due on or before it and
     * either unsettled or settled in a later month.
     */
    public boolean outstandingAsOf(YearMonth asOf) {
        if (monthDue == null || monthDue.isAfter(asOf)) {
            return false;
        }
        return !status.settled() || (monthPaid != null && monthPaid.isAfter(asOf));
    }

    public boolean settledLate() {
        return status.settled() && monthDue != null && monthPaid != null && monthPaid.isAfter(monthDue);
    }
}
