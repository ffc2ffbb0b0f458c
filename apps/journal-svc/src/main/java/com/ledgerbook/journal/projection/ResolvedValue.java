package com.ledgerbook.journal.projection;

import java.math.BigDecimal;

public record ResolvedValue(BigDecimal amount, CellSource source) {

    public static ResolvedValue actual(BigDecimal amount) {
        return new ResolvedValue(amount, CellSource.ACTUAL);
    }

    public static ResolvedValue computed(BigDecimal amount) {
        return new ResolvedValue(amount, CellSource.COMPUTED);
    }

    public boolean overridden() {
        return source == CellSource.OVERRIDE;
    }

    public boolean projected() {
        return source == CellSource.PROJECTED;
    }
}
