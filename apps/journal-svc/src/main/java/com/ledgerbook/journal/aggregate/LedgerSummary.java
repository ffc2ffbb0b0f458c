package com.ledgerbook.journal.aggregate;

import java.math.BigDecimal;

/**
 * Headline figures across the whole ledger.
 *
 * @param cashBalance everything received minus everything paid
 * @param lateReceivables receivables collected in a month after they were due
 * @param latePayables payables settled in a month after they were due
 */
public record LedgerSummary(
        BigDecimal cashBalance,
        BigDecimal pendingReceivables,
        BigDecimal pendingPayables,
        BigDecimal lateReceivables,
        BigDecimal latePayables,
        int transactionCount
) {
}
