package com.ledgerbook.journal.schedule;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One scheduled loan payment. For a skipped payment {@code payment} and {@code principal} are zero
 * and {@code interest} is what would have accrued for the period.
 */
public record AmortizationEntry(
        int number,
        YearMonth month,
        BigDecimal payment,
        BigDecimal principal,
        BigDecimal interest,
        BigDecimal endingBalance,
        boolean skipped
) {
}
