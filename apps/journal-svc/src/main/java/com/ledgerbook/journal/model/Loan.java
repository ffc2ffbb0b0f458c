package com.ledgerbook.journal.model;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A loan record as entered. Parameter sanity (rate, term, frequency) is checked when the
 * amortization schedule is generated, not here, so that stored records can always be loaded.
 */
public record Loan(
        long id,
        String name,
        BigDecimal principal,
        BigDecimal annualRate,
        int termMonths,
        int paymentsPerYear,
        LocalDate startDate,
        String notes
) {

    public Loan {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("loan name must be provided");
        }
        if (principal == null || principal.signum() < 0) {
            throw new IllegalArgumentException("principal must be zero or positive");
        }
        if (annualRate == null) {
            throw new IllegalArgumentException("annual rate must be provided");
        }
        if (startDate == null) {
            throw new IllegalArgumentException("start date must be provided");
        }
        principal = Money.round(principal);
    }
}
