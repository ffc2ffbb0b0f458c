package com.ledgerbook.journal.model;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of user-entered cell values keyed by (category, month). Passed explicitly to every
 * statement computation; changing an override means building a new instance.
 */
public final class Overrides {

    /** Reserved category id carrying the income-tax override row. Never a real category. */
    public static final long INCOME_TAX_CATEGORY_ID = -1L;

    private static final Overrides EMPTY = new Overrides(Map.of());

    private final Map<OverrideKey, BigDecimal> values;

    private Overrides(Map<OverrideKey, BigDecimal> values) {
        this.values = values;
    }

    public static Overrides empty() {
        return EMPTY;
    }

    public static Overrides of(Map<OverrideKey, BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<OverrideKey, BigDecimal> copy = new LinkedHashMap<>();
        values.forEach((key, amount) -> {
            if (amount != null) {
                copy.put(key, Money.round(amount));
            }
        });
        return new Overrides(Collections.unmodifiableMap(copy));
    }

    public Optional<BigDecimal> find(long categoryId, YearMonth month) {
        return Optional.ofNullable(values.get(new OverrideKey(categoryId, month)));
    }

    /** Copy with the cell set, or removed when {@code amount} is null. */
    public Overrides with(long categoryId, YearMonth month, BigDecimal amount) {
        Map<OverrideKey, BigDecimal> copy = new LinkedHashMap<>(values);
        OverrideKey key = new OverrideKey(categoryId, month);
        if (amount == null) {
            copy.remove(key);
        } else {
            copy.put(key, Money.round(amount));
        }
        return copy.isEmpty() ? EMPTY : new Overrides(Collections.unmodifiableMap(copy));
    }

    public Map<OverrideKey, BigDecimal> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Overrides that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Overrides" + values;
    }
}
