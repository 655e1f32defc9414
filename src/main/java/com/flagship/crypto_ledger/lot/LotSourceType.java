package com.flagship.crypto_ledger.lot;

/**
 * How a lot was acquired.
 */
public enum LotSourceType {
    PURCHASE,
    MINING,
    STAKING,
    AIRDROP,
    TRANSFER_IN
}
