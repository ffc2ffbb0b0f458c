package com.ledgerbook.journal.schedule;

public class InvalidLoanParametersException extends IllegalArgumentException {

    public InvalidLoanParametersException(String message) {
        super(message);
    }
}
