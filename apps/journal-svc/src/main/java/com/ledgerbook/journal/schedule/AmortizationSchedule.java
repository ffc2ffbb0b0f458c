package com.ledgerbook.journal.schedule;

import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

public record AmortizationSchedule(
        BigDecimal principal,
        BigDecimal periodicRate,
        int scheduledPayments,
        BigDecimal levelPayment,
        List<AmortizationEntry> entries
) {

    public AmortizationSchedule {
        entries = List.copyOf(entries);
    }

    /** Interest over every row, skipped rows included: the effective cost of the loan. */
    public BigDecimal totalInterest() {
        return entries.stream().map(AmortizationEntry::interest).reduce(Money.ZERO, BigDecimal::add);
    }

    /** Interest actually collected with payments. */
    public BigDecimal interestPaid() {
        return entries.stream()
                .filter(entry -> !entry.skipped())
                .map(AmortizationEntry::interest)
                .reduce(Money.ZERO, BigDecimal::add);
    }

    public BigDecimal totalPrincipal() {
        return entries.stream().map(AmortizationEntry::principal).reduce(Money.ZERO, BigDecimal::add);
    }

    public BigDecimal finalBalance() {
        return entries.isEmpty() ? Money.round(principal) : entries.get(entries.size() - 1).endingBalance();
    }

    /**
     * Ending balance after the last payment falling on or before {@code asOf}; the full principal
     * while no payment has come due yet.
     */
    public BigDecimal balanceAsOf(YearMonth asOf) {
        BigDecimal balance = Money.round(principal);
        for (AmortizationEntry entry : entries) {
            if (entry.month().isAfter(asOf)) {
                break;
            }
            balance = entry.endingBalance();
        }
        return balance;
    }
}
