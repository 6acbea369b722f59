package net.hearth.integration.spring;

import net.hearth.adapter.jdbc.JdbcTxRunner;
import net.hearth.adapter.jdbc.TxRunner;
import net.hearth.adapter.jdbc.repo.JdbcWarmRunRepository;
import net.hearth.core.service.WarmRunRecorder;
import net.hearth.core.spi.WarmRunRepository;
import net.hearth.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** Run-history wiring: transaction runner, JDBC repository and the listener that records every warm. */
@Configuration(proxyBeanMethods = false)
public class HearthSpringConfig {

    // Spring-managed transactions when a manager is present, plain JDBC otherwise
    @Bean
    public TxRunner hearthTxRunner(DataSource ds, ObjectProvider<PlatformTransactionManager> tm) {
        PlatformTransactionManager manager = tm.getIfUnique();
        return manager != null ? new SpringTxRunner(manager, ds) : new JdbcTxRunner(ds);
    }

    @Bean
    public WarmRunRepository warmRunRepository(TxRunner hearthTxRunner) {
        return new JdbcWarmRunRepository(hearthTxRunner);
    }

    @Bean
    public WarmRunRecorder warmRunRecorder(WarmRunRepository warmRunRepository) {
        return new WarmRunRecorder(warmRunRepository);
    }
}
