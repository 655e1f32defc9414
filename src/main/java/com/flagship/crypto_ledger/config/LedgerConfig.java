package com.flagship.crypto_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction templates for lock-scoped work.
 *
 * The ledger and the lot engine take their in-process locks before the
 * transaction starts and release them after it ends, so they drive transactions
 * programmatically instead of through {@code @Transactional}.
 */
@Configuration
public class LedgerConfig {

    /**
     * Read-write, joins an enclosing transaction when there is one.
     */
    @Bean
    public TransactionTemplate ledgerWriteTransactions(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        return template;
    }

    /**
     * Read-only REPEATABLE READ: every query in a chain scan sees the same snapshot.
     */
    @Bean
    public TransactionTemplate ledgerSnapshotTransactions(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        template.setReadOnly(true);
        return template;
    }
}
