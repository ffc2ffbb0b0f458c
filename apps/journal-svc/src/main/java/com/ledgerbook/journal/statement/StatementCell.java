package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.projection.CellSource;
import com.ledgerbook.journal.projection.ResolvedValue;
import java.math.BigDecimal;
import java.time.YearMonth;

public record StatementCell(YearMonth month, BigDecimal amount, CellSource source) {

    static StatementCell of(YearMonth month, ResolvedValue value) {
        return new StatementCell(month, value.amount(), value.source());
    }
}
