package com.ledgerbook.journal.aggregate;

import com.ledgerbook.journal.model.Category;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Insertion-ordered set of per-category monthly totals. Row order is the order categories were
 * first added, which the aggregator arranges to be display order.
 */
public final class CategoryGroup {

    private final Map<Long, CategoryTotals> rows = new LinkedHashMap<>();

    CategoryTotals row(Category category) {
        return rows.computeIfAbsent(category.id(), id -> new CategoryTotals(category));
    }

    void add(Category category, YearMonth month, BigDecimal amount) {
        row(category).add(month, amount);
    }

    public Collection<CategoryTotals> rows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    public List<Long> categoryIds() {
        return List.copyOf(rows.keySet());
    }

    public Optional<CategoryTotals> find(long categoryId) {
        return Optional.ofNullable(rows.get(categoryId));
    }

    public boolean contains(long categoryId) {
        return rows.containsKey(categoryId);
    }

    public Set<YearMonth> months() {
        Set<YearMonth> months = new TreeSet<>();
        rows.values().forEach(row -> months.addAll(row.byMonth().keySet()));
        return months;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
