package net.cloudjob.adapter.jdbc;

import net.cloudjob.adapter.jdbc.repo.JdbcJobStore;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.spi.JobStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class JdbcTxRunnerTest extends TestSupport {

    JdbcTxRunner tx;
    JobStore store;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        store = new JdbcJobStore();
    }

    @BeforeEach
    void truncate() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                st.execute("DELETE FROM TB_CLOUD_JOB");
            }
            return null;
        });
    }

    static Job job(String name) {
        return Job.ofNew(name, "", JobType.CUSTOM, Map.of(), 1, Instant.EPOCH);
    }

    @Test
    void exception_rollsBack_andPropagatesUnchanged() throws Exception {
        Job j = job("rolled-back");

        assertThatThrownBy(() -> tx.required(() -> {
            store.insert(j);
            throw new java.io.IOException("boom");
        })).isInstanceOf(java.io.IOException.class).hasMessage("boom");

        assertTrue(tx.required(() -> store.findById(j.jobId())).isEmpty());
        assertNull(TxContext.get(), "context cleared after transaction");
    }

    @Test
    void required_joinsOuterTransaction() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.get();
            Connection inner = tx.required(TxContext::get);
            assertSame(outer, inner);
            return null;
        });
    }

    @Test
    void requiresNew_commitsOnItsOwn_andLeavesNoContext() throws Exception {
        // SQLite 는 writer 가 하나라 바깥 트랜잭션 안에서 requiresNew 를 열면 busy 로 막힌다. 최상위에서만 사용
        Job j = job("standalone");
        tx.requiresNew(() -> store.insert(j));

        assertNull(TxContext.get());
        assertTrue(tx.required(() -> store.findById(j.jobId())).isPresent());
    }

    @Test
    void storeWithoutTransaction_isRejected() {
        assertThatThrownBy(() -> store.findById("x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TxContext required");
    }
}
