package com.ledgerbook.journal.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Currency helpers. Every stored or reported amount is rounded half-up to the cent.
 */
public final class Money {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    public static final BigDecimal ONE_CENT = new BigDecimal("0.01");

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : round(value);
    }

    public static BigDecimal sum(Collection<BigDecimal> values) {
        return values.stream()
                .map(Money::orZero)
                .reduce(ZERO, BigDecimal::add);
    }
}
