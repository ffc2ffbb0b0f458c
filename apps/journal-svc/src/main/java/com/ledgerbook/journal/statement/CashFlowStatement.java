package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

public record CashFlowStatement(
        YearMonth currentMonth,
        List<YearMonth> months,
        List<StatementRow> receipts,
        List<StatementRow> payments,
        List<Column> columns,
        Totals totals
) {

    public CashFlowStatement {
        months = List.copyOf(months);
        receipts = List.copyOf(receipts);
        payments = List.copyOf(payments);
        columns = List.copyOf(columns);
    }

    public record Column(
            YearMonth month,
            BigDecimal beginningBalance,
            BigDecimal receipts,
            BigDecimal payments,
            BigDecimal netCashFlow,
            BigDecimal endingBalance,
            boolean projected
    ) {
    }

    /** Additive quantities only; opening and closing balances are running state. */
    public record Totals(BigDecimal receipts, BigDecimal payments, BigDecimal netCashFlow) {
    }

    public Optional<Column> column(YearMonth month) {
        return columns.stream().filter(column -> column.month().equals(month)).findFirst();
    }

    /** Ending balance of the last column on or before {@code month}; zero before the first. */
    public BigDecimal endingBalanceAt(YearMonth month) {
        BigDecimal balance = Money.ZERO;
        for (Column column : columns) {
            if (column.month().isAfter(month)) {
                break;
            }
            balance = column.endingBalance();
        }
        return balance;
    }
}
