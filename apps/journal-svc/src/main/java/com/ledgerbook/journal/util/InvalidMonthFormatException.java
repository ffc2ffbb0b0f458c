package com.ledgerbook.journal.util;

public class InvalidMonthFormatException extends IllegalArgumentException {

    private final String rejectedValue;

    public InvalidMonthFormatException(String rejectedValue) {
        super("Invalid month format (expected YYYY-MM): " + rejectedValue);
        this.rejectedValue = rejectedValue;
    }

    public InvalidMonthFormatException(String rejectedValue, Throwable cause) {
        super("Invalid month format (expected YYYY-MM): " + rejectedValue, cause);
        this.rejectedValue = rejectedValue;
    }

    public String rejectedValue() {
        return rejectedValue;
    }
}
