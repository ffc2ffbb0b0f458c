package com.ledgerbook.journal.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgerbook.journal.model.DepreciationMethod;
import com.ledgerbook.journal.model.FixedAsset;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DepreciationScheduleGeneratorTest {

    private static FixedAsset asset(String cost, String salvage, int life, DepreciationMethod method) {
        return FixedAsset.of(1, "Van", new BigDecimal(cost), new BigDecimal(salvage), life, method, LocalDate.of(2024, 1, 15));
    }

    @Test
    void straightLineSpreadsEvenly() {
        Map<YearMonth, BigDecimal> schedule = DepreciationScheduleGenerator.generate(
                asset("12000", "0", 12, DepreciationMethod.STRAIGHT_LINE));

        assertThat(schedule).hasSize(12);
        assertThat(schedule.keySet()).first().isEqualTo(YearMonth.of(2024, 1));
        assertThat(schedule.values()).allMatch(amount -> amount.compareTo(new BigDecimal("1000.00")) == 0);
        assertThat(schedule).doesNotContainKey(YearMonth.of(2025, 1));
    }

    @Test
    void straightLineFinalMonthAbsorbsRounding() {
        Map<YearMonth, BigDecimal> schedule = DepreciationScheduleGenerator.generate(
                asset("1000", "0", 3, DepreciationMethod.STRAIGHT_LINE));

        assertThat(schedule.values()).containsExactly(
                new BigDecimal("333.33"), new BigDecimal("333.33"), new BigDecimal("333.34"));
        assertThat(Money.sum(schedule.values())).isEqualByComparingTo("1000.00");
    }

    @Test
    void straightLineTotalsExactlyAndNeverNegative() {
        for (String cost : List.of("999.99", "1234.57", "50000", "10.01")) {
            for (int life : List.of(1, 7, 36, 61)) {
                FixedAsset asset = asset(cost, "3.33", life, DepreciationMethod.STRAIGHT_LINE);
                Map<YearMonth, BigDecimal> schedule = DepreciationScheduleGenerator.generate(asset);
                assertThat(Money.sum(schedule.values())).isEqualByComparingTo(asset.depreciableBase());
                assertThat(schedule.values()).allMatch(amount -> amount.signum() >= 0);
                assertThat(schedule).hasSizeLessThanOrEqualTo(life);
            }
        }
    }

    @Test
    void doubleDecliningKeepsBookValueAboveSalvage() {
        FixedAsset asset = asset("10000", "1000", 24, DepreciationMethod.DOUBLE_DECLINING);
        Map<YearMonth, BigDecimal> schedule = DepreciationScheduleGenerator.generate(asset);

        assertThat(schedule).hasSizeLessThanOrEqualTo(24);
        assertThat(schedule.values()).first().isEqualTo(new BigDecimal("833.33"));
        BigDecimal book = asset.purchaseCost();
        for (BigDecimal amount : schedule.values()) {
            book = book.subtract(amount);
            assertThat(book).isGreaterThanOrEqualTo(asset.salvageValue());
        }
    }

    @Test
    void doubleDecliningStopsAtSalvage() {
        FixedAsset asset = asset("1000", "900", 4, DepreciationMethod.DOUBLE_DECLINING);
        Map<YearMonth, BigDecimal> schedule = DepreciationScheduleGenerator.generate(asset);

        // 500 would cross salvage, so the first month takes only the 100 available
        assertThat(schedule.values()).containsExactly(new BigDecimal("100.00"));
    }

    @Test
    void emptyWhenNothingToDepreciate() {
        assertThat(DepreciationScheduleGenerator.generate(asset("1000", "0", 12, DepreciationMethod.NONE))).isEmpty();
        assertThat(DepreciationScheduleGenerator.generate(asset("1000", "0", 0, DepreciationMethod.STRAIGHT_LINE))).isEmpty();
        assertThat(DepreciationScheduleGenerator.generate(asset("1000", "1000", 12, DepreciationMethod.STRAIGHT_LINE))).isEmpty();
        FixedAsset land = new FixedAsset(2, "Land", new BigDecimal("5000"), null, 12, DepreciationMethod.STRAIGHT_LINE,
                LocalDate.of(2024, 1, 1), null, false, null);
        assertThat(DepreciationScheduleGenerator.generate(land)).isEmpty();
    }

    @Test
    void startDateOverridesPurchaseMonth() {
        FixedAsset asset = new FixedAsset(3, "Printer", new BigDecimal("600"), null, 6, DepreciationMethod.STRAIGHT_LINE,
                LocalDate.of(2024, 1, 20), LocalDate.of(2024, 4, 1), true, null);

        assertThat(DepreciationScheduleGenerator.generate(asset).keySet()).first().isEqualTo(YearMonth.of(2024, 4));
    }

    @Test
    void aggregatesAcrossAssetsAndAccumulates() {
        FixedAsset first = asset("1200", "0", 12, DepreciationMethod.STRAIGHT_LINE);
        FixedAsset second = FixedAsset.of(2, "Desk", new BigDecimal("240"), BigDecimal.ZERO, 12,
                DepreciationMethod.STRAIGHT_LINE, LocalDate.of(2024, 2, 1));

        Map<YearMonth, BigDecimal> totals = DepreciationScheduleGenerator.totalByMonth(List.of(first, second), YearMonth.of(2024, 3));

        assertThat(totals).containsOnlyKeys(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3));
        assertThat(totals.get(YearMonth.of(2024, 1))).isEqualByComparingTo("100.00");
        assertThat(totals.get(YearMonth.of(2024, 2))).isEqualByComparingTo("120.00");
        assertThat(DepreciationScheduleGenerator.accumulatedAsOf(first, YearMonth.of(2024, 6))).isEqualByComparingTo("600.00");
        assertThat(DepreciationScheduleGenerator.accumulatedAsOf(first, YearMonth.of(2023, 12))).isEqualByComparingTo("0.00");
    }
}
