package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * One labelled line of a statement with a resolved cell per month. {@code categoryId} is null for
 * computed lines that do not belong to a category.
 */
public record StatementRow(String label, Long categoryId, List<StatementCell> cells, BigDecimal total) {

    public StatementRow {
        cells = List.copyOf(cells);
    }

    static StatementRow of(String label, Long categoryId, List<StatementCell> cells) {
        BigDecimal total = cells.stream().map(StatementCell::amount).reduce(Money.ZERO, BigDecimal::add);
        return new StatementRow(label, categoryId, cells, total);
    }

    public BigDecimal amountFor(YearMonth month) {
        return cells.stream()
                .filter(cell -> cell.month().equals(month))
                .map(StatementCell::amount)
                .findFirst()
                .orElse(Money.ZERO);
    }
}
