package com.ledgerbook.journal.export;

import com.ledgerbook.journal.model.Category;
import com.ledgerbook.journal.model.LedgerSnapshot;
import com.ledgerbook.journal.model.Transaction;
import com.ledgerbook.journal.util.Months;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the transaction ledger as CSV, newest entry first. Values that would break the row are
 * quoted with embedded quotes doubled; absent values are left empty.
 */
public final class TransactionCsvExporter {

    public static final List<String> HEADER = List.of(
            "Entry Date", "Category", "Type", "Amount", "Pretax Amount", "Status",
            "Month Due", "Month Paid", "Date Processed", "Payment For", "Notes");

    private static final Comparator<Transaction> NEWEST_FIRST = Comparator
            .comparing(Transaction::entryDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
            .thenComparing(Comparator.comparingLong(Transaction::id).reversed());

    private TransactionCsvExporter() {
    }

    public static String toCsv(LedgerSnapshot snapshot) {
        Map<Long, Category> categories = snapshot.categoriesById();
        StringBuilder sb = new StringBuilder();
        appendRow(sb, HEADER);
        snapshot.transactions().stream()
                .sorted(NEWEST_FIRST)
                .forEach(tx -> appendRow(sb, List.of(
                        date(tx.entryDate()),
                        categoryName(categories.get(tx.categoryId())),
                        label(tx.type().name()),
                        amount(tx.amount()),
                        amount(tx.pretaxAmount()),
                        label(tx.status().name()),
                        month(tx.monthDue()),
                        month(tx.monthPaid()),
                        date(tx.dateProcessed()),
                        month(tx.paymentForMonth()),
                        tx.notes() == null ? "" : tx.notes()
                )));
        return sb.toString();
    }

    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    private static void appendRow(StringBuilder sb, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(fields.get(i)));
        }
        sb.append('\n');
    }

    private static String categoryName(Category category) {
        return category == null ? "" : category.name();
    }

    // RECEIVABLE -> Receivable
    private static String label(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static String amount(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private static String date(LocalDate value) {
        return value == null ? "" : value.toString();
    }

    private static String month(YearMonth value) {
        return value == null ? "" : Months.format(value);
    }
}
