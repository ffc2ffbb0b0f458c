package com.ledgerbook.journal.aggregate;

import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Transaction;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.util.function.Predicate;

public final class LedgerSummaryCalculator {

    private LedgerSummaryCalculator() {
    }

    public static LedgerSummary summarize(LedgerSnapshot snapshot) {
        BigDecimal received = total(snapshot, tx -> tx.receivable() && tx.status().settled());
        BigDecimal paid = total(snapshot, tx -> tx.payable() && tx.status().settled());
        return new LedgerSummary(
                received.subtract(paid),
                total(snapshot, tx -> tx.receivable() && !tx.status().settled()),
                total(snapshot, tx -> tx.payable() && !tx.status().settled()),
                total(snapshot, tx -> tx.receivable() && tx.settledLate()),
                total(snapshot, tx -> tx.payable() && tx.settledLate()),
                snapshot.transactions().size()
        );
    }

    private static BigDecimal total(LedgerSnapshot snapshot, Predicate<Transaction> filter) {
        return snapshot.transactions().stream()
                .filter(filter)
                .map(Transaction::amount)
                .reduce(Money.ZERO, BigDecimal::add);
    }
}
