package com.flagship.crypto_ledger.reconciliation;

public class AlertDispatchException extends RuntimeException {

    public AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
