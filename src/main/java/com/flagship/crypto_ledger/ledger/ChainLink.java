package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.util.UUID;

@Value
public class ChainLink {
    UUID entryId;
    Long sequenceNumber;
    String hash;
    String prevHash;
}
