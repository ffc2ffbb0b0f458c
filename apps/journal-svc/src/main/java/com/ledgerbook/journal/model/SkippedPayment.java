package com.ledgerbook.journal.model;

public record SkippedPayment(long loanId, int paymentNumber) {

    public SkippedPayment {
        if (paymentNumber <= 0) {
            throw new IllegalArgumentException("payment number must be positive");
        }
    }
}
