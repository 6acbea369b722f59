package net.hearth.integration.spring.tx;

import net.hearth.adapter.jdbc.TxContext;
import net.hearth.adapter.jdbc.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** {@link TxRunner} on top of a Spring transaction manager; binds Spring's connection into {@link TxContext}. */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate template;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.template = new TransactionTemplate(tm);
        this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return template.execute(status -> {
            // nested call: reuse the bound connection
            if (TxContext.get() != null) return call(body);

            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.set(con);
                return call(body);
            } finally {
                TxContext.clear();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
