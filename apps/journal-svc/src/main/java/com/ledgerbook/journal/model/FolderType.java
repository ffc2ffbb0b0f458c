package com.ledgerbook.journal.model;

public enum FolderType {
    PAYABLE,
    RECEIVABLE
}
