package com.flagship.crypto_ledger.observability;

import com.flagship.crypto_ledger.ledger.ChainVerification;
import com.flagship.crypto_ledger.ledger.HashChainLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-verifies the whole hash chain on a fixed delay.
 *
 * A break found here halts appends and turns the chainIntegrity health check DOWN.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.verify.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ChainVerificationScheduler {

    private final HashChainLedger ledger;

    @Scheduled(fixedDelayString = "${ledger.verify.interval-ms:3600000}",
               initialDelayString = "${ledger.verify.initial-delay-ms:60000}")
    public void verifyChain() {
        try {
            ChainVerification result = ledger.verifyChain();
            if (!result.isValid()) {
                log.error("Scheduled chain verification found a break at entry {}", result.getBrokenAtEntryId());
            }
        } catch (Exception e) {
            log.error("Scheduled chain verification could not run: {}", e.getMessage(), e);
        }
    }
}
