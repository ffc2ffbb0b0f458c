package com.ledgerbook.journal.model;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Paid-in capital settings. The expected/received dates decide from which month the seed money
 * and APIC appear on the balance sheet; received wins over expected.
 */
public record EquityConfig(
        BigDecimal commonStockPar,
        long commonStockShares,
        BigDecimal apic,
        LocalDate seedExpectedDate,
        LocalDate seedReceivedDate,
        LocalDate apicExpectedDate,
        LocalDate apicReceivedDate
) {

    public static final EquityConfig EMPTY = new EquityConfig(BigDecimal.ZERO, 0, BigDecimal.ZERO, null, null, null, null);

    public EquityConfig {
        commonStockPar = commonStockPar == null ? BigDecimal.ZERO : commonStockPar;
        apic = Money.orZero(apic);
    }

    public BigDecimal commonStockAsOf(YearMonth asOf) {
        if (effectiveAfter(seedReceivedDate, seedExpectedDate, asOf)) {
            return Money.ZERO;
        }
        return Money.round(commonStockPar.multiply(BigDecimal.valueOf(commonStockShares)));
    }

    public BigDecimal apicAsOf(YearMonth asOf) {
        if (effectiveAfter(apicReceivedDate, apicExpectedDate, asOf)) {
            return Money.ZERO;
        }
        return apic;
    }

    private static boolean effectiveAfter(LocalDate received, LocalDate expected, YearMonth asOf) {
        LocalDate effective = received != null ? received : expected;
        return effective != null && YearMonth.from(effective).isAfter(asOf);
    }
}
