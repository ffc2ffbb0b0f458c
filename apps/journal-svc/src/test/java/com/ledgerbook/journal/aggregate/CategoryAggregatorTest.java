package com.ledgerbook.journal.aggregate;

import static com.ledgerbook.journal.LedgerFixtures.month;
import static com.ledgerbook.journal.LedgerFixtures.payable;
import static com.ledgerbook.journal.LedgerFixtures.receivable;
import static org.assertj.core.api.Assertions.assertThat;

import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.OverrideKey;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.model.Transaction;
import com.ledgerbook.journal.model.TransactionStatus;
import com.ledgerbook.journal.model.TransactionType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CategoryAggregatorTest {

    private static final Category CONSULTING = Category.of(1, "Consulting").withSortOrder(2);
    private static final Category ADVERTISING = Category.of(2, "advertising").withSortOrder(1);
    private static final Category BOOKS = Category.of(3, "Books").withSortOrder(1);
    private static final Category MATERIALS = Category.of(4, "Materials").withFlags(true, false, false, false);
    private static final Category SALES_TAX = Category.of(5, "Sales tax").withFlags(false, false, true, false);
    private static final Category DEPRECIATION = Category.of(6, "Depreciation").withFlags(false, true, false, false);
    private static final Category TRANSFERS = Category.of(7, "Transfers").withFlags(false, false, false, true);

    private static LedgerSnapshot snapshot(List<Transaction> transactions) {
        return new LedgerSnapshot(1, transactions,
                List.of(CONSULTING, ADVERTISING, BOOKS, MATERIALS, SALES_TAX, DEPRECIATION, TRANSFERS),
                null, null, null, null, null, null, null);
    }

    @Test
    void cashBasisGroupsSettledByMonthPaid() {
        CashBasisTotals totals = CategoryAggregator.cashBasis(snapshot(List.of(
                receivable(1, 1, "500", "2024-01", "2024-02"),
                receivable(2, 1, "250", "2024-02", "2024-02"),
                receivable(3, 1, "999", "2024-02", null),
                payable(4, 2, "80", "2024-01", "2024-01"),
                payable(5, 7, "40", "2024-01", "2024-03")
        )), Overrides.empty());

        CategoryTotals consulting = totals.receipts().find(1).orElseThrow();
        assertThat(consulting.amountFor(month("2024-01"))).isEqualByComparingTo("0");
        assertThat(consulting.amountFor(month("2024-02"))).isEqualByComparingTo("750.00");
        assertThat(totals.payments().categoryIds()).containsExactly(7L, 2L);
        assertThat(totals.months()).containsExactly(month("2024-01"), month("2024-02"), month("2024-03"));
    }

    @Test
    void rowsFollowSortOrderThenName() {
        CashBasisTotals totals = CategoryAggregator.cashBasis(snapshot(List.of(
                payable(1, 1, "1", "2024-01", "2024-01"),
                payable(2, 3, "1", "2024-01", "2024-01"),
                payable(3, 2, "1", "2024-01", "2024-01")
        )), Overrides.empty());

        assertThat(totals.payments().categoryIds()).containsExactly(2L, 3L, 1L);
    }

    @Test
    void accrualBasisClassifiesByFlags() {
        Transaction pretax = new Transaction(10, null, 1, new BigDecimal("1080"), new BigDecimal("1000"),
                TransactionType.RECEIVABLE, TransactionStatus.PENDING, month("2024-01"), null, null, null, null);
        AccrualBasisTotals totals = CategoryAggregator.accrualBasis(snapshot(List.of(
                pretax,
                payable(11, 4, "300", "2024-01", null),
                payable(12, 2, "120", "2024-01", "2024-03"),
                payable(13, 5, "80", "2024-01", null),
                payable(14, 6, "50", "2024-01", null),
                payable(15, 7, "700", "2024-01", null),
                receivable(16, 7, "900", "2024-01", null)
        )), Overrides.empty());

        assertThat(totals.revenue().find(1).orElseThrow().amountFor(month("2024-01"))).isEqualByComparingTo("1000.00");
        assertThat(totals.cogs().categoryIds()).containsExactly(4L);
        assertThat(totals.operatingExpenses().categoryIds()).containsExactly(2L);
        assertThat(totals.revenue().contains(7)).isFalse();
        assertThat(totals.depreciationCategories()).containsExactly(DEPRECIATION);
    }

    @Test
    void unknownCategoriesContributeNothing() {
        AccrualBasisTotals totals = CategoryAggregator.accrualBasis(snapshot(List.of(
                receivable(1, 99, "500", "2024-01", "2024-01")
        )), Overrides.empty());

        assertThat(totals.revenue().isEmpty()).isTrue();
        assertThat(CategoryAggregator.cashBasis(snapshot(List.of(
                receivable(1, 99, "500", "2024-01", "2024-01"))), Overrides.empty()).months()).isEmpty();
    }

    @Test
    void overrideOnlyCategoriesGetRows() {
        Category retainer = Category.of(8, "Retainer").withDefaultType(TransactionType.RECEIVABLE);
        Category software = Category.of(9, "Software");
        LedgerSnapshot snapshot = new LedgerSnapshot(1, List.of(), List.of(retainer, software, DEPRECIATION),
                null, null, null, null, null, null, null);
        Overrides overrides = Overrides.of(Map.of(
                new OverrideKey(8, month("2024-05")), new BigDecimal("400"),
                new OverrideKey(9, month("2024-05")), new BigDecimal("60"),
                new OverrideKey(6, month("2024-05")), new BigDecimal("25"),
                new OverrideKey(Overrides.INCOME_TAX_CATEGORY_ID, month("2024-05")), new BigDecimal("10")));

        AccrualBasisTotals totals = CategoryAggregator.accrualBasis(snapshot, overrides);

        assertThat(totals.revenue().categoryIds()).containsExactly(8L);
        assertThat(totals.operatingExpenses().categoryIds()).containsExactly(9L);
        assertThat(totals.months()).isEmpty();
    }

    @Test
    void cashOverridesWithoutSettledCashGetRows() {
        Category grant = Category.of(10, "Grant").withDefaultType(TransactionType.RECEIVABLE);
        Category insurance = Category.of(11, "Insurance");
        LedgerSnapshot snapshot = new LedgerSnapshot(1, List.of(), List.of(grant, insurance),
                null, null, null, null, null, null, null);
        Overrides overrides = Overrides.of(Map.of(
                new OverrideKey(10, month("2024-04")), new BigDecimal("5000"),
                new OverrideKey(11, month("2024-04")), new BigDecimal("90")));

        CashBasisTotals totals = CategoryAggregator.cashBasis(snapshot, overrides);

        assertThat(totals.receipts().categoryIds()).containsExactly(10L);
        assertThat(totals.payments().categoryIds()).containsExactly(11L);
    }
}
