package com.flagship.crypto_ledger.lot;

/**
 * A lot request with a non-positive quantity or a negative amount.
 * Raised before anything is written.
 */
public class InvalidQuantityException extends IllegalArgumentException {

    public InvalidQuantityException(String message) {
        super(message);
    }
}
