package com.ledgerbook.journal.model;

public enum TransactionStatus {
    PENDING,
    PAID,
    RECEIVED;

    public boolean settled() {
        return this != PENDING;
    }

    public boolean validFor(TransactionType type) {
        return switch (this) {
            case PENDING -> true;
            case PAID -> type == TransactionType.PAYABLE;
            case RECEIVED -> type == TransactionType.RECEIVABLE;
        };
    }
}
