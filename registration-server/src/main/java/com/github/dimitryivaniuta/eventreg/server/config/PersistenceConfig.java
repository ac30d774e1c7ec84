package com.github.dimitryivaniuta.eventreg.server.config;

import com.github.dimitryivaniuta.eventreg.common.r2dbc.ExistenceCheck;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.R2dbcQueryExecutor;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * Wires the query engine's storage binding and the transaction operator.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public R2dbcQueryExecutor r2dbcQueryExecutor(final DatabaseClient databaseClient) {
        return new R2dbcQueryExecutor(databaseClient);
    }

    @Bean
    public ExistenceCheck existenceCheck(final R2dbcQueryExecutor executor) {
        return new ExistenceCheck(executor);
    }

    @Bean
    public TransactionalOperator transactionalOperator(final ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    /** Time source for token and key expiry; replaced by a fixed clock in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
