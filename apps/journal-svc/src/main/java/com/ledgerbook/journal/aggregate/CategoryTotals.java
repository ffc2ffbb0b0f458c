package com.ledgerbook.journal.aggregate;

import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Monthly totals for one category. Months are kept in chronological order.
 */
public final class CategoryTotals {

    private final Category category;
    private final Map<YearMonth, BigDecimal> byMonth = new TreeMap<>();

    CategoryTotals(Category category) {
        this.category = category;
    }

    void add(YearMonth month, BigDecimal amount) {
        byMonth.merge(month, Money.orZero(amount), BigDecimal::add);
    }

    public Category category() {
        return category;
    }

    public long categoryId() {
        return category.id();
    }

    public BigDecimal amountFor(YearMonth month) {
        return byMonth.getOrDefault(month, Money.ZERO);
    }

    public Map<YearMonth, BigDecimal> byMonth() {
        return Collections.unmodifiableMap(byMonth);
    }

    @Override
    public String toString() {
        return "CategoryTotals{" + category.name() + "=" + byMonth + "}";
    }
}
