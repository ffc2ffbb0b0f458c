package com.ledgerbook.journal.model;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * A ledger category. Categories are maintained elsewhere; statements only read them.
 *
 * <p>{@code suppressedFromPl} keeps the category out of the Profit &amp; Loss revenue, COGS and
 * operating-expense sections. The stored form of this flag is named {@code show_on_pl} even
 * though a true value hides the category.
 */
public record Category(
        long id,
        String name,
        Long folderId,
        boolean monthly,
        BigDecimal defaultAmount,
        TransactionType defaultType,
        int cashflowSortOrder,
        boolean cogs,
        boolean depreciation,
        boolean salesTax,
        boolean suppressedFromPl
) {

    /** Cash-flow and statement row order: explicit sort order, then name. */
    public static final Comparator<Category> DISPLAY_ORDER = Comparator
            .comparingInt(Category::cashflowSortOrder)
            .thenComparing(Category::name, String.CASE_INSENSITIVE_ORDER);

    public Category {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("category name must be provided");
        }
        name = name.trim();
    }

    public static Category of(long id, String name) {
        return new Category(id, name, null, false, null, null, 0, false, false, false, false);
    }

    public Category withFlags(boolean cogs, boolean depreciation, boolean salesTax, boolean suppressedFromPl) {
        return new Category(id, name, folderId, monthly, defaultAmount, defaultType, cashflowSortOrder,
                cogs, depreciation, salesTax, suppressedFromPl);
    }

    public Category withSortOrder(int sortOrder) {
        return new Category(id, name, folderId, monthly, defaultAmount, defaultType, sortOrder,
                cogs, depreciation, salesTax, suppressedFromPl);
    }

    public Category withDefaultType(TransactionType type) {
        return new Category(id, name, folderId, monthly, defaultAmount, type, cashflowSortOrder,
                cogs, depreciation, salesTax, suppressedFromPl);
    }
}
