package com.ledgerbook.journal.statement;

import static com.ledgerbook.journal.LedgerFixtures.month;
import static com.ledgerbook.journal.LedgerFixtures.payable;
import static com.ledgerbook.journal.LedgerFixtures.receivable;
import static org.assertj.core.api.Assertions.assertThat;

import com.ledgerbook.journal.LedgerFixtures;
import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.OverrideKey;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.projection.CellSource;
import com.ledgerbook.journal.util.Months;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CashFlowBuilderTest {

    private final CashFlowBuilder builder = new CashFlowBuilder();

    @Test
    void runningBalanceStartsFromZero() {
        LedgerSnapshot snapshot = LedgerFixtures.balancedLedger();

        CashFlowStatement cashFlow = builder.build(snapshot,
                Months.range(month("2024-01"), month("2024-03")), month("2024-03"));

        CashFlowStatement.Column january = cashFlow.columns().get(0);
        assertThat(january.beginningBalance()).isEqualByComparingTo("0.00");
        assertThat(january.receipts()).isEqualByComparingTo("11200.00");
        assertThat(january.endingBalance()).isEqualByComparingTo("11200.00");

        CashFlowStatement.Column february = cashFlow.columns().get(1);
        assertThat(february.beginningBalance()).isEqualByComparingTo("11200.00");
        assertThat(february.payments()).isEqualByComparingTo("2300.00");
        assertThat(february.netCashFlow()).isEqualByComparingTo("2700.00");
        assertThat(february.endingBalance()).isEqualByComparingTo("13900.00");

        assertThat(cashFlow.endingBalanceAt(month("2024-03"))).isEqualByComparingTo("13800.00");
        assertThat(cashFlow.totals().receipts()).isEqualByComparingTo("16200.00");
        assertThat(cashFlow.totals().payments()).isEqualByComparingTo("2400.00");
        assertThat(cashFlow.totals().netCashFlow()).isEqualByComparingTo("13800.00");
    }

    @Test
    void pendingTransactionsDoNotMoveCash() {
        LedgerSnapshot snapshot = LedgerFixtures.balancedLedger();

        assertThat(builder.activeMonths(snapshot))
                .containsExactly(month("2024-01"), month("2024-02"), month("2024-03"));
        CashFlowStatement cashFlow = builder.build(snapshot, List.of(month("2024-03")), month("2024-03"));
        assertThat(cashFlow.columns().get(0).receipts()).isEqualByComparingTo("0.00");
    }

    @Test
    void overridesAndProjectionsFeedTheBalance() {
        Category sales = Category.of(1, "Sales");
        Category rent = Category.of(2, "Rent");
        Overrides overrides = Overrides.of(Map.of(new OverrideKey(2, month("2024-03")), new BigDecimal("500")));
        LedgerSnapshot snapshot = new LedgerSnapshot(1, List.of(
                receivable(1, 1, "1000", "2024-01", "2024-01"),
                receivable(2, 1, "2000", "2024-02", "2024-02"),
                payable(3, 2, "800", "2024-01", "2024-01")
        ), List.of(sales, rent), null, null, null, null, null, overrides, null);

        CashFlowStatement cashFlow = builder.build(snapshot,
                Months.range(month("2024-01"), month("2024-03")), month("2024-02"));

        CashFlowStatement.Column march = cashFlow.column(month("2024-03")).orElseThrow();
        assertThat(march.projected()).isTrue();
        assertThat(march.receipts()).isEqualByComparingTo("1500.00");
        assertThat(march.payments()).isEqualByComparingTo("500.00");
        assertThat(march.endingBalance()).isEqualByComparingTo("3200.00");
        assertThat(cashFlow.payments().get(0).cells().get(2).source()).isEqualTo(CellSource.OVERRIDE);
        assertThat(builder.activeMonths(snapshot)).contains(month("2024-03"));
    }
}
