package com.ledgerbook.journal.model;

import java.util.Locale;

/**
 * How income tax is presented on the Profit &amp; Loss statement.
 */
public enum TaxMode {
    /** Flat corporate rate on positive pre-tax income, overridable per month. */
    CORPORATE,
    /** Income passes through to the owners; the statement carries no tax. */
    PASSTHROUGH;

    public static TaxMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tax mode must be provided");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (TaxMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown tax mode: " + value);
    }
}
