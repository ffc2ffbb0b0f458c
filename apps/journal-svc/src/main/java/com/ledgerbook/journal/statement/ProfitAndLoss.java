package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.model.TaxMode;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

public record ProfitAndLoss(
        TaxMode taxMode,
        YearMonth currentMonth,
        List<YearMonth> months,
        List<StatementRow> revenue,
        List<StatementRow> costOfGoodsSold,
        List<StatementRow> operatingExpenses,
        StatementRow incomeTax,
        List<Column> columns,
        Column total
) {

    /** Shown in place of a gross margin when there is no revenue to divide by. */
    public static final String MARGIN_NOT_APPLICABLE = "-";

    public ProfitAndLoss {
        months = List.copyOf(months);
        revenue = List.copyOf(revenue);
        costOfGoodsSold = List.copyOf(costOfGoodsSold);
        operatingExpenses = List.copyOf(operatingExpenses);
        columns = List.copyOf(columns);
    }

    /**
     * Figures for one month, or for the whole statement when {@code month} is null. In the total
     * column {@code cumulativeNetIncome} is the closing cumulative figure.
     */
    public record Column(
            YearMonth month,
            BigDecimal revenue,
            BigDecimal costOfGoodsSold,
            BigDecimal grossProfit,
            Optional<BigDecimal> grossMarginPercent,
            BigDecimal operatingExpenses,
            BigDecimal netIncomeBeforeTax,
            BigDecimal incomeTax,
            BigDecimal netIncomeAfterTax,
            BigDecimal cumulativeNetIncome,
            boolean projected
    ) {

        public String grossMarginDisplay() {
            return grossMarginPercent.map(pct -> pct.toPlainString() + "%").orElse(MARGIN_NOT_APPLICABLE);
        }
    }

    public Optional<Column> column(YearMonth month) {
        return columns.stream().filter(column -> column.month().equals(month)).findFirst();
    }

    /** Cumulative net income after tax through {@code month}; zero before the first column. */
    public BigDecimal cumulativeNetIncomeThrough(YearMonth month) {
        BigDecimal result = Money.ZERO;
        for (Column column : columns) {
            if (column.month().isAfter(month)) {
                break;
            }
            result = column.cumulativeNetIncome();
        }
        return result;
    }
}
