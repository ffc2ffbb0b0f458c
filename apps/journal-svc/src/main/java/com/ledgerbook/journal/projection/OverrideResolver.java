package com.ledgerbook.journal.projection;

import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides the value a statement cell shows. Precedence: a user override for the cell, then a
 * run-rate projection for future months with nothing booked, then the computed baseline.
 */
public final class OverrideResolver {

    private OverrideResolver() {
    }

    /**
     * @param history the category's monthly totals; only months up to {@code currentMonth} count
     *                toward a projection
     * @param currentMonth last month treated as history; {@code null} disables projection
     */
    public static ResolvedValue resolve(
            long categoryId,
            YearMonth month,
            BigDecimal baseline,
            Map<YearMonth, BigDecimal> history,
            YearMonth currentMonth,
            Overrides overrides
    ) {
        Optional<BigDecimal> override = overrides.find(categoryId, month);
        if (override.isPresent()) {
            return new ResolvedValue(override.get(), CellSource.OVERRIDE);
        }
        BigDecimal computed = Money.orZero(baseline);
        if (currentMonth != null && month.isAfter(currentMonth) && computed.signum() == 0) {
            return new ResolvedValue(runRate(history, currentMonth), CellSource.PROJECTED);
        }
        return ResolvedValue.actual(computed);
    }

    /**
     * Mean of the non-zero totals recorded in months up to and including {@code currentMonth};
     * zero when there are none.
     */
    public static BigDecimal runRate(Map<YearMonth, BigDecimal> history, YearMonth currentMonth) {
        if (history == null || history.isEmpty()) {
            return Money.ZERO;
        }
        List<BigDecimal> past = history.entrySet().stream()
                .filter(entry -> !entry.getKey().isAfter(currentMonth))
                .map(Map.Entry::getValue)
                .filter(amount -> amount != null && amount.signum() != 0)
                .toList();
        if (past.isEmpty()) {
            return Money.ZERO;
        }
        BigDecimal total = past.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(past.size()), 2, RoundingMode.HALF_UP);
    }
}
