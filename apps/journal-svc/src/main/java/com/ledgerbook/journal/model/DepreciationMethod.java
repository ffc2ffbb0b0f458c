package com.ledgerbook.journal.model;

public enum DepreciationMethod {
    STRAIGHT_LINE,
    DOUBLE_DECLINING,
    NONE
}
