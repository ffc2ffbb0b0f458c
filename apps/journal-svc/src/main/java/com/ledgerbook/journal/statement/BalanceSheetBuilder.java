package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.FixedAsset;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Loan;
import com.ledgerbook.journal.model.TaxMode;
import com.ledgerbook.journal.model.Transaction;
import com.ledgerbook.journal.schedule.AmortizationScheduleGenerator;
import com.ledgerbook.journal.schedule.DepreciationScheduleGenerator;
import com.ledgerbook.journal.util.Money;
import com.ledgerbook.journal.util.Months;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Builds the balance sheet at the end of a month and checks that assets equal liabilities plus
 * equity. Cash and retained earnings come from the cash-flow and profit-and-loss statements run
 * from the first month with data through the as-of month.
 */
public class BalanceSheetBuilder {

    private final ProfitAndLossBuilder profitAndLossBuilder;
    private final CashFlowBuilder cashFlowBuilder;
    private final BigDecimal tolerance;

    public BalanceSheetBuilder(ProfitAndLossBuilder profitAndLossBuilder, CashFlowBuilder cashFlowBuilder,
            BigDecimal tolerance) {
        if (tolerance == null || tolerance.signum() <= 0) {
            throw new IllegalArgumentException("balance tolerance must be positive: " + tolerance);
        }
        this.profitAndLossBuilder = profitAndLossBuilder;
        this.cashFlowBuilder = cashFlowBuilder;
        this.tolerance = tolerance;
    }

    public BalanceSheet build(LedgerSnapshot snapshot, YearMonth asOf, YearMonth currentMonth, TaxMode taxMode) {
        if (asOf == null) {
            throw new IllegalArgumentException("as-of month must be provided");
        }
        Map<Long, Category> categories = snapshot.categoriesById();

        BigDecimal cash = cashFlowBuilder
                .build(snapshot, throughAsOf(cashFlowBuilder.activeMonths(snapshot), asOf), currentMonth)
                .endingBalanceAt(asOf);

        List<Transaction> openReceivables = outstanding(snapshot, categories, asOf, Transaction::receivable);
        List<Transaction> openPayables = outstanding(snapshot, categories, asOf,
                tx -> tx.payable() && !categories.get(tx.categoryId()).salesTax());
        // category lines list positive balances only; the totals keep credits
        List<BalanceSheet.CategoryBalance> receivables = byCategory(openReceivables, categories);
        List<BalanceSheet.CategoryBalance> payables = byCategory(openPayables, categories);
        BigDecimal accountsReceivable = sum(openReceivables);
        BigDecimal accountsPayable = sum(openPayables);
        BigDecimal salesTaxPayable = sum(outstanding(snapshot, categories, asOf,
                tx -> tx.payable() && categories.get(tx.categoryId()).salesTax()));

        List<BalanceSheet.FixedAssetLine> assetLines = new ArrayList<>();
        BigDecimal assetCost = Money.ZERO;
        BigDecimal accumulated = Money.ZERO;
        for (FixedAsset asset : snapshot.fixedAssets()) {
            if (asset.purchaseMonth().isAfter(asOf)) {
                continue;
            }
            BigDecimal assetAccumulated = DepreciationScheduleGenerator.accumulatedAsOf(asset, asOf);
            assetLines.add(new BalanceSheet.FixedAssetLine(asset.id(), asset.name(), asset.purchaseCost(),
                    assetAccumulated, asset.purchaseCost().subtract(assetAccumulated)));
            assetCost = assetCost.add(asset.purchaseCost());
            accumulated = accumulated.add(assetAccumulated);
        }
        BigDecimal netFixedAssets = assetCost.subtract(accumulated);

        List<BalanceSheet.LoanBalance> loanLines = new ArrayList<>();
        BigDecimal loansPayable = Money.ZERO;
        for (Loan loan : snapshot.loans()) {
            if (YearMonth.from(loan.startDate()).isAfter(asOf)) {
                continue;
            }
            BigDecimal balance = AmortizationScheduleGenerator
                    .generate(loan, snapshot.skippedPaymentNumbers(loan.id()))
                    .balanceAsOf(asOf);
            loanLines.add(new BalanceSheet.LoanBalance(loan.id(), loan.name(), balance));
            loansPayable = loansPayable.add(balance);
        }

        BigDecimal commonStock = snapshot.equity().commonStockAsOf(asOf);
        BigDecimal apic = snapshot.equity().apicAsOf(asOf);
        BigDecimal retainedEarnings = profitAndLossBuilder
                .build(snapshot, throughAsOf(profitAndLossBuilder.activeMonths(snapshot), asOf), currentMonth, taxMode)
                .cumulativeNetIncomeThrough(asOf);

        BigDecimal totalAssets = cash.add(accountsReceivable).add(netFixedAssets);
        BigDecimal totalLiabilities = accountsPayable.add(salesTaxPayable).add(loansPayable);
        BigDecimal totalEquity = commonStock.add(apic).add(retainedEarnings);
        BigDecimal liabilitiesAndEquity = totalLiabilities.add(totalEquity);
        BigDecimal difference = totalAssets.subtract(liabilitiesAndEquity);
        boolean balanced = difference.abs().compareTo(tolerance) < 0;

        return new BalanceSheet(asOf, currentMonth != null && asOf.isAfter(currentMonth),
                cash, receivables, accountsReceivable,
                assetLines, assetCost, accumulated, netFixedAssets, totalAssets,
                payables, accountsPayable, salesTaxPayable, loanLines, loansPayable, totalLiabilities,
                commonStock, apic, retainedEarnings, totalEquity, liabilitiesAndEquity, difference, balanced);
    }

    /** From the first active month through {@code asOf}; empty when nothing happens by then. */
    private static List<YearMonth> throughAsOf(Set<YearMonth> active, YearMonth asOf) {
        return active.stream()
                .min(YearMonth::compareTo)
                .filter(first -> !first.isAfter(asOf))
                .map(first -> Months.range(first, asOf))
                .orElse(List.of());
    }

    private static List<Transaction> outstanding(LedgerSnapshot snapshot, Map<Long, Category> categories,
            YearMonth asOf, Predicate<Transaction> filter) {
        return snapshot.transactions().stream()
                .filter(tx -> categories.containsKey(tx.categoryId()))
                .filter(filter)
                .filter(tx -> tx.outstandingAsOf(asOf))
                .toList();
    }

    private static List<BalanceSheet.CategoryBalance> byCategory(List<Transaction> open,
            Map<Long, Category> categories) {
        Map<Long, BigDecimal> totals = new LinkedHashMap<>();
        open.forEach(tx -> totals.merge(tx.categoryId(), tx.amount(), BigDecimal::add));
        return totals.entrySet().stream()
                .filter(entry -> entry.getValue().signum() > 0)
                .map(entry -> new BalanceSheet.CategoryBalance(entry.getKey(),
                        categories.get(entry.getKey()).name(), entry.getValue()))
                .sorted(Comparator.comparing(BalanceSheet.CategoryBalance::categoryName, String.CASE_INSENSITIVE_ORDER))
                .toList();
    }

    private static BigDecimal sum(List<Transaction> transactions) {
        return transactions.stream().map(Transaction::amount).reduce(Money.ZERO, BigDecimal::add);
    }
}
