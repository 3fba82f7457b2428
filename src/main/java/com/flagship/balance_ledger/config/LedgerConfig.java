package com.flagship.balance_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction templates for the ledger's atomic units.
 *
 * - transactionTemplate: one atomic unit per orchestrator operation (REQUIRED)
 * - savepointTransactionTemplate: savepoint inside the current unit (NESTED),
 *   used for best-effort history writes
 *
 * Both need the JDBC transaction manager; JPA's would not support savepoints.
 */
@Configuration
public class LedgerConfig {

    @Bean
    @Primary
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        return template;
    }

    @Bean
    public TransactionTemplate savepointTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        return template;
    }
}
