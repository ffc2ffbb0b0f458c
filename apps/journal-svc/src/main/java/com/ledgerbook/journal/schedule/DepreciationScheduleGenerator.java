package com.ledgerbook.journal.schedule;

import com.ledgerbook.journal.model.DepreciationMethod;
import com.ledgerbook.journal.model.FixedAsset;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Month-by-month depreciation for fixed assets.
 */
public final class DepreciationScheduleGenerator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private DepreciationScheduleGenerator() {
    }

    /**
     * Ordered month to amount schedule for one asset, starting at its depreciation start month.
     * Empty for {@link DepreciationMethod#NONE}, non-depreciable assets, a non-positive life, or a
     * cost that does not exceed salvage.
     */
    public static Map<YearMonth, BigDecimal> generate(FixedAsset asset) {
        if (asset == null
                || !asset.depreciable()
                || asset.depreciationMethod() == DepreciationMethod.NONE
                || asset.usefulLifeMonths() <= 0
                || asset.purchaseCost().compareTo(asset.salvageValue()) <= 0) {
            return Map.of();
        }
        Map<YearMonth, BigDecimal> schedule = asset.depreciationMethod() == DepreciationMethod.DOUBLE_DECLINING
                ? doubleDeclining(asset)
                : straightLine(asset);
        return Collections.unmodifiableMap(schedule);
    }

    private static Map<YearMonth, BigDecimal> straightLine(FixedAsset asset) {
        int life = asset.usefulLifeMonths();
        BigDecimal base = asset.depreciableBase();
        BigDecimal monthly = base.divide(BigDecimal.valueOf(life), 2, RoundingMode.HALF_UP);
        YearMonth start = asset.depreciationStartMonth();

        Map<YearMonth, BigDecimal> schedule = new LinkedHashMap<>();
        BigDecimal remaining = base;
        for (int i = 0; i < life && remaining.signum() > 0; i++) {
            // last month takes whatever is left so the lifetime total is exact
            BigDecimal amount = i == life - 1 ? remaining : monthly.min(remaining);
            if (amount.signum() > 0) {
                schedule.put(start.plusMonths(i), amount);
            }
            remaining = remaining.subtract(amount);
        }
        return schedule;
    }

    private static Map<YearMonth, BigDecimal> doubleDeclining(FixedAsset asset) {
        int life = asset.usefulLifeMonths();
        BigDecimal salvage = asset.salvageValue();
        YearMonth start = asset.depreciationStartMonth();

        Map<YearMonth, BigDecimal> schedule = new LinkedHashMap<>();
        BigDecimal bookValue = asset.purchaseCost();
        for (int i = 0; i < life; i++) {
            BigDecimal amount = bookValue.multiply(TWO).divide(BigDecimal.valueOf(life), 2, RoundingMode.HALF_UP);
            if (bookValue.subtract(amount).compareTo(salvage) < 0) {
                amount = bookValue.subtract(salvage);
            }
            if (amount.compareTo(Money.ONE_CENT) < 0) {
                break;
            }
            schedule.put(start.plusMonths(i), amount);
            bookValue = bookValue.subtract(amount);
        }
        return schedule;
    }

    /**
     * Depreciation summed across assets per month, in chronological order. When {@code asOf} is
     * set, later months are left out.
     */
    public static Map<YearMonth, BigDecimal> totalByMonth(Collection<FixedAsset> assets, YearMonth asOf) {
        Map<YearMonth, BigDecimal> totals = new TreeMap<>();
        for (FixedAsset asset : assets) {
            generate(asset).forEach((month, amount) -> {
                if (asOf == null || !month.isAfter(asOf)) {
                    totals.merge(month, amount, BigDecimal::add);
                }
            });
        }
        return totals;
    }

    /** Depreciation booked for {@code asset} in months up to and including {@code asOf}. */
    public static BigDecimal accumulatedAsOf(FixedAsset asset, YearMonth asOf) {
        return generate(asset).entrySet().stream()
                .filter(entry -> !entry.getKey().isAfter(asOf))
                .map(Map.Entry::getValue)
                .reduce(Money.ZERO, BigDecimal::add);
    }
}
