package com.ledgerbook.journal.util;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Year-month parsing and range helpers. Months travel as {@code YYYY-MM} strings at the edges
 * and as {@link YearMonth} everywhere else.
 */
public final class Months {

    private static final Pattern MONTH_PATTERN = Pattern.compile("\\d{4}-\\d{2}");
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");

    private Months() {
    }

    public static YearMonth parse(String value) {
        if (value == null || !MONTH_PATTERN.matcher(value.trim()).matches()) {
            throw new InvalidMonthFormatException(value);
        }
        try {
            return YearMonth.parse(value.trim(), FORMAT);
        } catch (DateTimeParseException ex) {
            throw new InvalidMonthFormatException(value, ex);
        }
    }

    public static Optional<YearMonth> parseOptional(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parse(value));
    }

    public static String format(YearMonth month) {
        return month == null ? "" : FORMAT.format(month);
    }

    /**
     * Inclusive range of consecutive months. Empty when {@code end} precedes {@code start}.
     */
    public static List<YearMonth> range(YearMonth start, YearMonth end) {
        List<YearMonth> months = new ArrayList<>();
        if (start == null || end == null) {
            return months;
        }
        YearMonth cursor = start;
        while (!cursor.isAfter(end)) {
            months.add(cursor);
            cursor = cursor.plusMonths(1);
        }
        return months;
    }

    /**
     * Contiguous months spanning every month in {@code seen}, narrowed or widened by the optional
     * timeline bounds.
     */
    public static List<YearMonth> span(Collection<YearMonth> seen, YearMonth timelineStart, YearMonth timelineEnd) {
        YearMonth first = timelineStart;
        YearMonth last = timelineEnd;
        if (first == null) {
            first = seen.stream().min(YearMonth::compareTo).orElse(null);
        }
        if (last == null) {
            last = seen.stream().max(YearMonth::compareTo).orElse(null);
        }
        return range(first, last);
    }
}
