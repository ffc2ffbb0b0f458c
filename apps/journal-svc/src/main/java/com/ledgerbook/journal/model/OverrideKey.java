package com.ledgerbook.journal.model;

import java.time.YearMonth;

public record OverrideKey(long categoryId, YearMonth month) {

    public OverrideKey {
        if (month == null) {
            throw new IllegalArgumentException("override month must be provided");
        }
    }
}
