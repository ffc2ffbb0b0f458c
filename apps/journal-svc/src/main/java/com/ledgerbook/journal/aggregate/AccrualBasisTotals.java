package com.ledgerbook.journal.aggregate;

import com.ledgerbook.journal.model.Category;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Profit &amp; Loss inputs grouped by due month. Depreciation categories carry no totals; their
 * cells come from overrides alone.
 */
public record AccrualBasisTotals(
        CategoryGroup revenue,
        CategoryGroup cogs,
        CategoryGroup operatingExpenses,
        List<Category> depreciationCategories
) {

    public AccrualBasisTotals {
        depreciationCategories = List.copyOf(depreciationCategories);
    }

    public Set<YearMonth> months() {
        Set<YearMonth> months = new TreeSet<>(revenue.months());
        months.addAll(cogs.months());
        months.addAll(operatingExpenses.months());
        return months;
    }
}
