package com.flagship.crypto_ledger.ledger;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Ordered chain links ending at {@link #entryId}. When {@link #fromGenesis} is false
 * the proof covers only a bounded window and starts mid-chain.
 */
@Value
public class HashProof {
    UUID entryId;
    List<ChainLink> links;
    boolean fromGenesis;

    public List<String> getHashes() {
        return links.stream().map(ChainLink::getHash).toList();
    }

    /**
     * Checks that each link points at the hash of the link before it.
     * Does not recompute digests; that needs the entry content.
     */
    public boolean isContiguous() {
        for (int i = 1; i < links.size(); i++) {
            if (!links.get(i).getPrevHash().equals(links.get(i - 1).getHash())) {
                return false;
            }
        }
        return links.isEmpty()
            || !fromGenesis
            || EntryHasher.GENESIS_HASH.equals(links.get(0).getPrevHash());
    }
}
