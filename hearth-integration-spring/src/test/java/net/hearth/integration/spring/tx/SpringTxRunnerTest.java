package net.hearth.integration.spring.tx;

import net.hearth.adapter.jdbc.TxContext;
import net.hearth.adapter.jdbc.repo.JdbcWarmRunRepository;
import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmTrigger;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    SpringTxRunner tx;
    JdbcWarmRunRepository runs;
    final Instant t0 = Instant.parse("2024-06-01T12:00:00Z");

    @BeforeAll
    void setupDb() {
        var ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:spring-tx;MODE=Oracle;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        Flyway.configure().dataSource(ds).locations("classpath:db/migration/oracle").load().migrate();

        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
        runs = new JdbcWarmRunRepository(tx);
    }

    @BeforeEach
    void truncate() {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                st.execute("DELETE FROM TB_WARM_RUN");
            }
            return null;
        });
    }

    @Test
    void commits_and_releases_the_connection() throws Exception {
        long id = runs.save(WarmRun.succeeded("s", "default", WarmTrigger.MANUAL, 3, t0, t0));
        assertTrue(id > 0);
        assertNull(TxContext.get());
        assertEquals(1, runs.findRecent("s", 5).size());
    }

    @Test
    void nested_calls_share_one_transaction_and_roll_back_together() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            runs.save(WarmRun.succeeded("s", "default", WarmTrigger.MANUAL, 1, t0, t0));
            throw new IllegalStateException("abort");
        }));
        assertEquals(0, runs.findRecent("s", 5).size());
    }

    @Test
    void checked_exceptions_are_wrapped() {
        var ex = assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            throw new java.io.IOException("disk");
        }));
        assertInstanceOf(java.io.IOException.class, ex.getCause());
    }
}
