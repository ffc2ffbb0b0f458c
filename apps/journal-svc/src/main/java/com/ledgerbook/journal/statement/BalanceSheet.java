package com.ledgerbook.journal.statement;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Point-in-time position at the end of {@code asOf}. {@code difference} is total assets minus
 * total liabilities and equity; {@code balanced} holds when it is within the configured tolerance.
 * The by-category lists carry categories with a positive open balance, while
 * {@code accountsReceivable} and {@code accountsPayable} total every open line, credits included.
 */
public record BalanceSheet(
        YearMonth asOf,
        boolean projected,
        BigDecimal cash,
        List<CategoryBalance> receivablesByCategory,
        BigDecimal accountsReceivable,
        List<FixedAssetLine> fixedAssets,
        BigDecimal fixedAssetCost,
        BigDecimal accumulatedDepreciation,
        BigDecimal netFixedAssets,
        BigDecimal totalAssets,
        List<CategoryBalance> payablesByCategory,
        BigDecimal accountsPayable,
        BigDecimal salesTaxPayable,
        List<LoanBalance> loans,
        BigDecimal loansPayable,
        BigDecimal totalLiabilities,
        BigDecimal commonStock,
        BigDecimal additionalPaidInCapital,
        BigDecimal retainedEarnings,
        BigDecimal totalEquity,
        BigDecimal totalLiabilitiesAndEquity,
        BigDecimal difference,
        boolean balanced
) {

    public BalanceSheet {
        receivablesByCategory = List.copyOf(receivablesByCategory);
        fixedAssets = List.copyOf(fixedAssets);
        payablesByCategory = List.copyOf(payablesByCategory);
        loans = List.copyOf(loans);
    }

    public record CategoryBalance(long categoryId, String categoryName, BigDecimal amount) {
    }

    public record FixedAssetLine(long assetId, String name, BigDecimal cost, BigDecimal accumulatedDepreciation,
            BigDecimal netBookValue) {
    }

    public record LoanBalance(long loanId, String name, BigDecimal balance) {
    }
}
