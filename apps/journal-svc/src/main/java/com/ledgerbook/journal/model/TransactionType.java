package com.ledgerbook.journal.model;

public enum TransactionType {
    RECEIVABLE,
    PAYABLE
}
