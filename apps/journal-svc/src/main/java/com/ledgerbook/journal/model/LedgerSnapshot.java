package com.ledgerbook.journal.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Consistent, immutable view of every record one computation pass reads. Collections are copied
 * on construction so later changes to the caller's lists never leak into a running computation.
 */
public record LedgerSnapshot(
        long version,
        List<Transaction> transactions,
        List<Category> categories,
        List<Folder> folders,
        List<FixedAsset> fixedAssets,
        List<Loan> loans,
        List<SkippedPayment> skippedPayments,
        Overrides plOverrides,
        Overrides cashFlowOverrides,
        EquityConfig equity
) {

    public LedgerSnapshot {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        categories = categories == null ? List.of() : List.copyOf(categories);
        folders = folders == null ? List.of() : List.copyOf(folders);
        fixedAssets = fixedAssets == null ? List.of() : List.copyOf(fixedAssets);
        loans = loans == null ? List.of() : List.copyOf(loans);
        skippedPayments = skippedPayments == null ? List.of() : List.copyOf(skippedPayments);
        plOverrides = plOverrides == null ? Overrides.empty() : plOverrides;
        cashFlowOverrides = cashFlowOverrides == null ? Overrides.empty() : cashFlowOverrides;
        equity = equity == null ? EquityConfig.EMPTY : equity;
    }

    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(0, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                Overrides.empty(), Overrides.empty(), EquityConfig.EMPTY);
    }

    public Map<Long, Category> categoriesById() {
        return categories.stream()
                .collect(Collectors.toMap(Category::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    public Optional<Category> findCategory(long categoryId) {
        return categories.stream().filter(category -> category.id() == categoryId).findFirst();
    }

    public Optional<FixedAsset> findFixedAsset(long assetId) {
        return fixedAssets.stream().filter(asset -> asset.id() == assetId).findFirst();
    }

    public Optional<Loan> findLoan(long loanId) {
        return loans.stream().filter(loan -> loan.id() == loanId).findFirst();
    }

    public Set<Integer> skippedPaymentNumbers(long loanId) {
        return skippedPayments.stream()
                .filter(skipped -> skipped.loanId() == loanId)
                .map(SkippedPayment::paymentNumber)
                .collect(Collectors.toUnmodifiableSet());
    }

    public LedgerSnapshot withVersion(long newVersion) {
        return new LedgerSnapshot(newVersion, transactions, categories, folders, fixedAssets, loans,
                skippedPayments, plOverrides, cashFlowOverrides, equity);
    }

    public LedgerSnapshot withPlOverrides(Overrides overrides) {
        return new LedgerSnapshot(version, transactions, categories, folders, fixedAssets, loans,
                skippedPayments, overrides, cashFlowOverrides, equity);
    }

    public LedgerSnapshot withCashFlowOverrides(Overrides overrides) {
        return new LedgerSnapshot(version, transactions, categories, folders, fixedAssets, loans,
                skippedPayments, plOverrides, overrides, equity);
    }
}
