package com.ledgerbook.journal.aggregate;

import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.OverrideKey;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.model.Transaction;
import com.ledgerbook.journal.model.TransactionType;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Groups transactions by category and month on a cash or an accrual basis. Transactions whose
 * category is unknown are ignored.
 */
public final class CategoryAggregator {

    private CategoryAggregator() {
    }

    /**
     * Settled transactions grouped by month paid, split into receipts and payments. A category can
     * appear on both sides. Categories with overrides but no settled cash get an empty row on the
     * side their default type points to.
     */
    public static CashBasisTotals cashBasis(LedgerSnapshot snapshot, Overrides overrides) {
        Map<Long, Category> categories = snapshot.categoriesById();
        CategoryGroup receipts = new CategoryGroup();
        CategoryGroup payments = new CategoryGroup();
        for (Transaction tx : inDisplayOrder(snapshot.transactions(), categories)) {
            if (!tx.status().settled() || tx.monthPaid() == null) {
                continue;
            }
            Category category = categories.get(tx.categoryId());
            CategoryGroup target = tx.receivable() ? receipts : payments;
            target.add(category, tx.monthPaid(), tx.amount());
        }
        overrideOnlyCategories(categories, overrides)
                .filter(category -> !receipts.contains(category.id()) && !payments.contains(category.id()))
                .forEach(category -> {
                    if (category.defaultType() == TransactionType.RECEIVABLE) {
                        receipts.row(category);
                    } else {
                        payments.row(category);
                    }
                });
        return new CashBasisTotals(receipts, payments);
    }

    /**
     * Transactions of every status grouped by month due into revenue, cost of goods sold and
     * operating expenses, skipping categories suppressed from the P&amp;L.
     *
     * <p>Categories that only carry overrides are given a row too so their overridden cells reach the
     * totals: COGS-flagged ones under COGS, others by their default type.
     */
    public static AccrualBasisTotals accrualBasis(LedgerSnapshot snapshot, Overrides overrides) {
        Map<Long, Category> categories = snapshot.categoriesById();
        CategoryGroup revenue = new CategoryGroup();
        CategoryGroup cogs = new CategoryGroup();
        CategoryGroup opex = new CategoryGroup();

        for (Transaction tx : inDisplayOrder(snapshot.transactions(), categories)) {
            if (tx.monthDue() == null) {
                continue;
            }
            Category category = categories.get(tx.categoryId());
            if (category.suppressedFromPl()) {
                continue;
            }
            if (category.cogs()) {
                cogs.add(category, tx.monthDue(), tx.amount());
            } else if (tx.receivable()) {
                revenue.add(category, tx.monthDue(), tx.revenueAmount());
            } else if (isOrdinaryExpense(category)) {
                opex.add(category, tx.monthDue(), tx.amount());
            }
        }

        addOverrideOnlyRows(categories, overrides, revenue, cogs, opex);

        List<Category> depreciation = categories.values().stream()
                .filter(Category::depreciation)
                .sorted(Category.DISPLAY_ORDER)
                .toList();
        return new AccrualBasisTotals(revenue, cogs, opex, depreciation);
    }

    private static void addOverrideOnlyRows(Map<Long, Category> categories, Overrides overrides,
            CategoryGroup revenue, CategoryGroup cogs, CategoryGroup opex) {
        overrideOnlyCategories(categories, overrides)
                .filter(category -> !category.suppressedFromPl() && !category.depreciation())
                .filter(category -> !revenue.contains(category.id())
                        && !cogs.contains(category.id())
                        && !opex.contains(category.id()))
                .forEach(category -> {
                    if (category.cogs()) {
                        cogs.row(category);
                    } else if (category.defaultType() == TransactionType.RECEIVABLE) {
                        revenue.row(category);
                    } else if (isOrdinaryExpense(category)) {
                        opex.row(category);
                    }
                });
    }

    private static Stream<Category> overrideOnlyCategories(Map<Long, Category> categories, Overrides overrides) {
        return overrides.asMap().keySet().stream()
                .map(OverrideKey::categoryId)
                .distinct()
                .filter(id -> id != Overrides.INCOME_TAX_CATEGORY_ID)
                .map(categories::get)
                .filter(Objects::nonNull)
                .sorted(Category.DISPLAY_ORDER);
    }

    private static boolean isOrdinaryExpense(Category category) {
        return !category.cogs() && !category.depreciation() && !category.salesTax() && !category.suppressedFromPl();
    }

    private static List<Transaction> inDisplayOrder(List<Transaction> transactions, Map<Long, Category> categories) {
        return transactions.stream()
                .filter(tx -> categories.containsKey(tx.categoryId()))
                .sorted(Comparator.comparing(tx -> categories.get(tx.categoryId()), Category.DISPLAY_ORDER))
                .toList();
    }
}
