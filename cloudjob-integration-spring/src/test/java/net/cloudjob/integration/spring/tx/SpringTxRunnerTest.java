package net.cloudjob.integration.spring.tx;

import com.zaxxer.hikari.HikariDataSource;
import net.cloudjob.adapter.jdbc.TxContext;
import net.cloudjob.adapter.jdbc.repo.JdbcJobStore;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.spi.JobStore;
import net.cloudjob.integration.spring.SqliteSupport;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    HikariDataSource ds;
    SpringTxRunner tx;
    JobStore store = new JdbcJobStore();

    @BeforeAll
    void setUp() throws Exception {
        ds = SqliteSupport.migratedDataSource(SqliteSupport.tempDir());
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @AfterAll
    void tearDown() {
        ds.close();
    }

    @Test
    void commit_isVisibleToNextTransaction() {
        Job j = Job.ofNew("committed", "", JobType.CUSTOM, Map.of(), 1, Instant.EPOCH);

        tx.required(() -> store.insert(j));

        assertTrue(tx.required(() -> store.findById(j.jobId())).isPresent());
        assertNull(TxContext.get());
    }

    @Test
    void checkedException_rollsBack_andIsWrapped() {
        Job j = Job.ofNew("rolled-back", "", JobType.CUSTOM, Map.of(), 1, Instant.EPOCH);

        assertThatThrownBy(() -> tx.required(() -> {
            store.insert(j);
            throw new java.io.IOException("boom");
        })).isInstanceOf(IllegalStateException.class).hasCauseInstanceOf(java.io.IOException.class);

        assertTrue(tx.required(() -> store.findById(j.jobId())).isEmpty());
    }

    @Test
    void nestedRequired_sharesConnection() {
        tx.required(() -> {
            var outer = TxContext.get();
            assertSame(outer, tx.required(TxContext::get));
            return null;
        });
    }
}
