package com.flagship.finance_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Shard pools are created by {@link com.flagship.finance_ledger.config.ShardConfig};
 * the single auto-configured DataSource is switched off.
 */
@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class FinanceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceLedgerApplication.class, args);
    }
}
