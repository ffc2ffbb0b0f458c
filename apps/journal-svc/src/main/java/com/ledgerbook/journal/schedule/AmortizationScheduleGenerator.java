package com.ledgerbook.journal.schedule;

import com.ledgerbook.journal.model.Loan;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Level-payment loan amortization with support for skipped payments.
 *
 * <p>A skipped payment leaves the balance untouched and reports the interest that accrued for the
 * period without collecting it. Every skip pushes one extra period onto the end of the schedule so
 * the balance is still retired.
 */
public final class AmortizationScheduleGenerator {

    private static final MathContext PRECISION = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private AmortizationScheduleGenerator() {
    }

    public static AmortizationSchedule generate(Loan loan, Set<Integer> skippedPayments) {
        return generate(loan.principal(), loan.annualRate(), loan.termMonths(), loan.paymentsPerYear(),
                loan.startDate(), skippedPayments);
    }

    public static AmortizationSchedule generate(
            BigDecimal principal,
            BigDecimal annualRate,
            int termMonths,
            int paymentsPerYear,
            LocalDate startDate,
            Set<Integer> skippedPayments
    ) {
        validate(principal, annualRate, termMonths, paymentsPerYear, startDate);
        Set<Integer> skipped = skippedPayments == null ? Set.of() : skippedPayments;

        int scheduled = (int) ((long) termMonths * paymentsPerYear / 12);
        if (scheduled < 1) {
            throw new InvalidLoanParametersException(
                    "term of " + termMonths + " months yields no payments at " + paymentsPerYear + " per year");
        }
        BigDecimal rate = annualRate.divide(HUNDRED, PRECISION).divide(BigDecimal.valueOf(paymentsPerYear), PRECISION);
        BigDecimal payment = levelPayment(Money.round(principal), rate, scheduled);

        int lastNumber = extendedLength(scheduled, skipped);
        int lastCollectedNumber = lastCollected(lastNumber, skipped);

        YearMonth startMonth = YearMonth.from(startDate);
        List<AmortizationEntry> entries = new ArrayList<>();
        BigDecimal balance = Money.round(principal);
        for (int number = 1; number <= lastNumber; number++) {
            YearMonth month = startMonth.plusMonths(Math.round(number * 12.0 / paymentsPerYear));
            BigDecimal interest = balance.multiply(rate).setScale(2, RoundingMode.HALF_UP);
            if (skipped.contains(number)) {
                entries.add(new AmortizationEntry(number, month, Money.ZERO, Money.ZERO, interest, balance, true));
                continue;
            }
            BigDecimal principalPart = payment.subtract(interest);
            if (number == lastCollectedNumber || principalPart.compareTo(balance) > 0) {
                principalPart = balance;
            }
            if (principalPart.signum() < 0) {
                principalPart = Money.ZERO;
            }
            BigDecimal actualPayment = principalPart.add(interest);
            balance = balance.subtract(principalPart);
            if (balance.compareTo(Money.ONE_CENT) < 0) {
                balance = Money.ZERO;
            }
            entries.add(new AmortizationEntry(number, month, actualPayment, principalPart, interest, balance, false));
        }
        return new AmortizationSchedule(Money.round(principal), rate, scheduled, payment, entries);
    }

    static BigDecimal levelPayment(BigDecimal principal, BigDecimal rate, int payments) {
        if (rate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(payments), 2, RoundingMode.HALF_UP);
        }
        // P * r / (1 - (1 + r)^-n)
        BigDecimal growth = BigDecimal.ONE.add(rate).pow(payments, PRECISION);
        BigDecimal discount = BigDecimal.ONE.subtract(BigDecimal.ONE.divide(growth, PRECISION));
        return principal.multiply(rate).divide(discount, 2, RoundingMode.HALF_UP);
    }

    private static int extendedLength(int scheduled, Set<Integer> skipped) {
        int length = scheduled;
        while (skippedUpTo(skipped, length) > length - scheduled) {
            length++;
        }
        return length;
    }

    private static long skippedUpTo(Set<Integer> skipped, int length) {
        return skipped.stream().filter(number -> number >= 1 && number <= length).count();
    }

    private static int lastCollected(int lastNumber, Set<Integer> skipped) {
        for (int number = lastNumber; number >= 1; number--) {
            if (!skipped.contains(number)) {
                return number;
            }
        }
        return -1;
    }

    private static void validate(BigDecimal principal, BigDecimal annualRate, int termMonths, int paymentsPerYear,
            LocalDate startDate) {
        if (principal == null || principal.signum() < 0) {
            throw new InvalidLoanParametersException("principal must be zero or positive");
        }
        if (annualRate == null || annualRate.signum() < 0) {
            throw new InvalidLoanParametersException("annual rate must not be negative: " + annualRate);
        }
        if (termMonths <= 0) {
            throw new InvalidLoanParametersException("term must be at least one month: " + termMonths);
        }
        if (paymentsPerYear <= 0) {
            throw new InvalidLoanParametersException("payments per year must be positive: " + paymentsPerYear);
        }
        if (startDate == null) {
            throw new InvalidLoanParametersException("start date must be provided");
        }
    }

    /**
     * Interest expense per month across loans, skipped payments excluded. When {@code asOf} is set,
     * later months are left out.
     */
    public static Map<YearMonth, BigDecimal> interestByMonth(
            Collection<Loan> loans,
            Function<Long, Set<Integer>> skippedLookup,
            YearMonth asOf
    ) {
        Map<YearMonth, BigDecimal> totals = new TreeMap<>();
        for (Loan loan : loans) {
            AmortizationSchedule schedule = generate(loan, skippedLookup.apply(loan.id()));
            for (AmortizationEntry entry : schedule.entries()) {
                if (entry.skipped() || (asOf != null && entry.month().isAfter(asOf))) {
                    continue;
                }
                totals.merge(entry.month(), entry.interest(), BigDecimal::add);
            }
        }
        return totals;
    }
}
