package com.ledgerbook.journal.statement;

import com.ledgerbook.journal.aggregate.CashBasisTotals;
import com.ledgerbook.journal.aggregate.CategoryAggregator;
import com.ledgerbook.journal.aggregate.CategoryGroup;
import com.ledgerbook.journal.aggregate.CategoryTotals;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.OverrideKey;
import com.ledgerbook.journal.model.Overrides;
import com.ledgerbook.journal.projection.OverrideResolver;
import com.ledgerbook.journal.projection.ResolvedValue;
import com.ledgerbook.journal.util.Money;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the cash-basis statement: settled receipts and payments per month with a running balance
 * that starts from zero at the first month of the range.
 */
public class CashFlowBuilder {

    public Set<YearMonth> activeMonths(LedgerSnapshot snapshot) {
        Set<YearMonth> months = new TreeSet<>(CategoryAggregator.cashBasis(snapshot, snapshot.cashFlowOverrides()).months());
        snapshot.cashFlowOverrides().asMap().keySet().stream().map(OverrideKey::month).forEach(months::add);
        return months;
    }

    public CashFlowStatement build(LedgerSnapshot snapshot, List<YearMonth> months, YearMonth currentMonth) {
        Overrides overrides = snapshot.cashFlowOverrides();
        CashBasisTotals cash = CategoryAggregator.cashBasis(snapshot, overrides);
        List<StatementRow> receiptRows = rows(cash.receipts(), months, currentMonth, overrides);
        List<StatementRow> paymentRows = rows(cash.payments(), months, currentMonth, overrides);

        List<CashFlowStatement.Column> columns = new ArrayList<>();
        BigDecimal running = Money.ZERO;
        BigDecimal totalReceipts = Money.ZERO;
        BigDecimal totalPayments = Money.ZERO;
        for (YearMonth month : months) {
            BigDecimal receipts = sumFor(receiptRows, month);
            BigDecimal payments = sumFor(paymentRows, month);
            BigDecimal net = receipts.subtract(payments);
            BigDecimal beginning = running;
            running = beginning.add(net);
            columns.add(new CashFlowStatement.Column(month, beginning, receipts, payments, net, running,
                    currentMonth != null && month.isAfter(currentMonth)));
            totalReceipts = totalReceipts.add(receipts);
            totalPayments = totalPayments.add(payments);
        }
        CashFlowStatement.Totals totals = new CashFlowStatement.Totals(totalReceipts, totalPayments,
                totalReceipts.subtract(totalPayments));
        return new CashFlowStatement(currentMonth, months, receiptRows, paymentRows, columns, totals);
    }

    private static List<StatementRow> rows(CategoryGroup group, List<YearMonth> months, YearMonth currentMonth,
            Overrides overrides) {
        List<StatementRow> rows = new ArrayList<>();
        for (CategoryTotals totals : group.rows()) {
            List<StatementCell> cells = new ArrayList<>();
            for (YearMonth month : months) {
                ResolvedValue value = OverrideResolver.resolve(totals.categoryId(), month, totals.amountFor(month),
                        totals.byMonth(), currentMonth, overrides);
                cells.add(StatementCell.of(month, value));
            }
            rows.add(StatementRow.of(totals.category().name(), totals.categoryId(), cells));
        }
        return rows;
    }

    private static BigDecimal sumFor(List<StatementRow> rows, YearMonth month) {
        return rows.stream().map(row -> row.amountFor(month)).reduce(Money.ZERO, BigDecimal::add);
    }
}
