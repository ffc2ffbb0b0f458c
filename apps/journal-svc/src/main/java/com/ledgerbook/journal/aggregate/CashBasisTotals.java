package com.ledgerbook.journal.aggregate;

import java.time.YearMonth;
import java.util.Set;
import java.util.TreeSet;

/** Settled cash movement grouped by the month it moved. */
public record CashBasisTotals(CategoryGroup receipts, CategoryGroup payments) {

    public Set<YearMonth> months() {
        Set<YearMonth> months = new TreeSet<>(receipts.months());
        months.addAll(payments.months());
        return months;
    }
}
