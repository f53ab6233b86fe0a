package se.ironyy_be.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Programmatic transactions for the workflow engine, which needs to retry a whole
 * read-validate-write cycle and to run work after commit.
 */
@Configuration(proxyBeanMethods = false)
public class TransactionConfig {

    @Bean("orderTx")
    TransactionTemplate orderTx(PlatformTransactionManager tm) {
        var tt = new TransactionTemplate(tm);
        tt.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        return tt;
    }

    @Bean("independentTx")
    TransactionTemplate independentTx(PlatformTransactionManager tm) {
        var tt = new TransactionTemplate(tm);
        tt.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return tt;
    }
}
