package com.flagship.crypto_ledger.config;

import com.flagship.crypto_ledger.reconciliation.OnChainBalanceSource;
import com.flagship.crypto_ledger.reconciliation.UnavailableOnChainBalanceSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ReconciliationConfig {

    @Bean
    @ConditionalOnMissingBean(OnChainBalanceSource.class)
    public OnChainBalanceSource onChainBalanceSource() {
        log.warn("No on-chain balance source configured; wallet reconciliation runs will fail until one is provided");
        return new UnavailableOnChainBalanceSource();
    }
}
