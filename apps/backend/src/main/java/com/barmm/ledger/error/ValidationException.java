package com.barmm.ledger.error;

public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "validation_error";
    }
}
