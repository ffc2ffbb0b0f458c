package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.aggregate.AccrualBasisTotals;
import com.ledgerbook.journal.aggregate.CategoryAggregator;
import com.ledgerbook.journal.aggregate.CategoryGroup;
import com.ledgerbook.journal.aggregate.CategoryTotals;
import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.OverrideKey;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.model.TaxMode;
import com.ledgerbook.journal.projection.CellSource;
import com.ledgerbook.journal.projection.OverrideResolver;
import com.ledgerbook.journal.projection.ResolvedValue;
import com.ledgerbook.journal.schedule.AmortizationScheduleGenerator;
import com.ledgerbook.journal.schedule.DepreciationScheduleGenerator;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the accrual-basis Profit &amp; Loss statement. Every subtotal is summed from resolved
 * cells, so overrides and projections always flow into the totals.
 */
public class ProfitAndLossBuilder {

    static final String ASSET_DEPRECIATION_LABEL = "Depreciation (Fixed Assets)";
    static final String LOAN_INTEREST_LABEL = "Interest Expense (Loans)";
    static final String CORPORATE_TAX_LABEL = "Income Tax";
    static final String PASSTHROUGH_TAX_LABEL = "Income Tax (pass-through to owners)";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal corporateTaxRate;

    public ProfitAndLossBuilder(BigDecimal corporateTaxRate) {
        if (corporateTaxRate == null || corporateTaxRate.signum() < 0 || corporateTaxRate.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("corporate tax rate must be between 0 and 1: " + corporateTaxRate);
        }
        this.corporateTaxRate = corporateTaxRate;
    }

    /** Every month the statement has something to show for: due dates, schedules and overrides. */
    public Set<YearMonth> activeMonths(LedgerSnapshot snapshot) {
        Set<YearMonth> months = new TreeSet<>(CategoryAggregator.accrualBasis(snapshot, snapshot.plOverrides()).months());
        months.addAll(DepreciationScheduleGenerator.totalByMonth(snapshot.fixedAssets(), null).keySet());
        months.addAll(AmortizationScheduleGenerator.interestByMonth(snapshot.loans(), snapshot::skippedPaymentNumbers, null).keySet());
        snapshot.plOverrides().asMap().keySet().stream().map(OverrideKey::month).forEach(months::add);
        return months;
    }

    public ProfitAndLoss build(LedgerSnapshot snapshot, List<YearMonth> months, YearMonth currentMonth, TaxMode taxMode) {
        Overrides overrides = snapshot.plOverrides();
        AccrualBasisTotals accrual = CategoryAggregator.accrualBasis(snapshot, overrides);

        List<StatementRow> revenueRows = categoryRows(accrual.revenue(), months, currentMonth, overrides);
        List<StatementRow> cogsRows = categoryRows(accrual.cogs(), months, currentMonth, overrides);
        List<StatementRow> opexRows = new ArrayList<>(categoryRows(accrual.operatingExpenses(), months, currentMonth, overrides));
        for (Category category : accrual.depreciationCategories()) {
            opexRows.add(overrideOnlyRow(category, months, overrides));
        }

        Map<YearMonth, BigDecimal> assetDepreciation = DepreciationScheduleGenerator.totalByMonth(snapshot.fixedAssets(), null);
        if (!assetDepreciation.isEmpty()) {
            opexRows.add(computedRow(ASSET_DEPRECIATION_LABEL, assetDepreciation, months));
        }
        Map<YearMonth, BigDecimal> loanInterest = AmortizationScheduleGenerator.interestByMonth(
                snapshot.loans(), snapshot::skippedPaymentNumbers, null);
        if (!loanInterest.isEmpty()) {
            opexRows.add(computedRow(LOAN_INTEREST_LABEL, loanInterest, months));
        }

        List<StatementCell> taxCells = new ArrayList<>();
        List<ProfitAndLoss.Column> columns = new ArrayList<>();
        BigDecimal cumulative = Money.ZERO;
        for (YearMonth month : months) {
            BigDecimal revenue = sumFor(revenueRows, month);
            BigDecimal cogs = sumFor(cogsRows, month);
            BigDecimal opex = sumFor(opexRows, month);
            BigDecimal grossProfit = revenue.subtract(cogs);
            BigDecimal beforeTax = grossProfit.subtract(opex);
            ResolvedValue tax = incomeTax(beforeTax, month, taxMode, overrides);
            taxCells.add(StatementCell.of(month, tax));
            BigDecimal afterTax = beforeTax.subtract(tax.amount());
            cumulative = cumulative.add(afterTax);
            columns.add(new ProfitAndLoss.Column(month, revenue, cogs, grossProfit, margin(grossProfit, revenue),
                    opex, beforeTax, tax.amount(), afterTax, cumulative,
                    currentMonth != null && month.isAfter(currentMonth)));
        }

        String taxLabel = taxMode == TaxMode.PASSTHROUGH ? PASSTHROUGH_TAX_LABEL : CORPORATE_TAX_LABEL;
        StatementRow taxRow = StatementRow.of(taxLabel, Overrides.INCOME_TAX_CATEGORY_ID, taxCells);
        return new ProfitAndLoss(taxMode, currentMonth, months, revenueRows, cogsRows, opexRows, taxRow,
                columns, totalColumn(columns, cumulative));
    }

    private ResolvedValue incomeTax(BigDecimal beforeTax, YearMonth month, TaxMode taxMode, Overrides overrides) {
        if (taxMode == TaxMode.PASSTHROUGH) {
            return ResolvedValue.computed(Money.ZERO);
        }
        Optional<BigDecimal> override = overrides.find(Overrides.INCOME_TAX_CATEGORY_ID, month);
        if (override.isPresent()) {
            return new ResolvedValue(override.get(), CellSource.OVERRIDE);
        }
        BigDecimal tax = beforeTax.signum() > 0 ? Money.round(beforeTax.multiply(corporateTaxRate)) : Money.ZERO;
        return ResolvedValue.computed(tax);
    }

    private static List<StatementRow> categoryRows(CategoryGroup group, List<YearMonth> months, YearMonth currentMonth,
            Overrides overrides) {
        List<StatementRow> rows = new ArrayList<>();
        for (CategoryTotals totals : group.rows()) {
            List<StatementCell> cells = new ArrayList<>();
            for (YearMonth month : months) {
                ResolvedValue value = OverrideResolver.resolve(totals.categoryId(), month, totals.amountFor(month),
                        totals.byMonth(), currentMonth, overrides);
                cells.add(StatementCell.of(month, value));
            }
            rows.add(StatementRow.of(totals.category().name(), totals.categoryId(), cells));
        }
        return rows;
    }

    private static StatementRow overrideOnlyRow(Category category, List<YearMonth> months, Overrides overrides) {
        List<StatementCell> cells = new ArrayList<>();
        for (YearMonth month : months) {
            ResolvedValue value = overrides.find(category.id(), month)
                    .map(amount -> new ResolvedValue(amount, CellSource.OVERRIDE))
                    .orElseGet(() -> ResolvedValue.actual(Money.ZERO));
            cells.add(StatementCell.of(month, value));
        }
        return StatementRow.of(category.name(), category.id(), cells);
    }

    private static StatementRow computedRow(String label, Map<YearMonth, BigDecimal> amounts, List<YearMonth> months) {
        List<StatementCell> cells = months.stream()
                .map(month -> StatementCell.of(month, ResolvedValue.computed(amounts.getOrDefault(month, Money.ZERO))))
                .toList();
        return StatementRow.of(label, null, cells);
    }

    private static BigDecimal sumFor(List<StatementRow> rows, YearMonth month) {
        return rows.stream().map(row -> row.amountFor(month)).reduce(Money.ZERO, BigDecimal::add);
    }

    static Optional<BigDecimal> margin(BigDecimal grossProfit, BigDecimal revenue) {
        if (revenue.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(grossProfit.multiply(HUNDRED).divide(revenue, 1, RoundingMode.HALF_UP));
    }

    private static ProfitAndLoss.Column totalColumn(List<ProfitAndLoss.Column> columns, BigDecimal closingCumulative) {
        BigDecimal revenue = Money.ZERO;
        BigDecimal cogs = Money.ZERO;
        BigDecimal opex = Money.ZERO;
        BigDecimal tax = Money.ZERO;
        for (ProfitAndLoss.Column column : columns) {
            revenue = revenue.add(column.revenue());
            cogs = cogs.add(column.costOfGoodsSold());
            opex = opex.add(column.operatingExpenses());
            tax = tax.add(column.incomeTax());
        }
        BigDecimal grossProfit = revenue.subtract(cogs);
        BigDecimal beforeTax = grossProfit.subtract(opex);
        return new ProfitAndLoss.Column(null, revenue, cogs, grossProfit, margin(grossProfit, revenue), opex,
                beforeTax, tax, beforeTax.subtract(tax), closingCumulative, false);
    }
}
