package com.ledgerbook.journal.projection;

public enum CellSource {
    /** Aggregated from transactions. */
    ACTUAL,
    /** User-entered value that replaced the computed one. */
    OVERRIDE,
    /** Future month filled in from the category's historical run rate. */
    PROJECTED,
    /** Derived from fixed-asset or loan schedules; not editable. */
    COMPUTED
}
