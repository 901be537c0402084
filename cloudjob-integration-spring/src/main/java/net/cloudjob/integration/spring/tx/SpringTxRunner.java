package net.cloudjob.integration.spring.tx;

import net.cloudjob.adapter.jdbc.TxContext;
import net.cloudjob.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** 스프링 트랜잭션의 물리 커넥션을 TxContext 에 꽂아서 JDBC 저장소가 그대로 쓰게 한다 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        return tpl.execute(status -> {
            Connection existing = TxContext.get();
            // REQUIRED 중첩 호출이면 바깥 커넥션 그대로 사용
            if (existing != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                return call(body);
            }

            // REQUIRES_NEW 는 스프링이 새 커넥션을 묶었으므로 그걸 꽂고, 끝나면 바깥 것을 복원
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.set(con);
                return call(body);
            } finally {
                TxContext.clear();
                if (existing != null) TxContext.set(existing);
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
            throw new IllegalStateException(e);
        }
    }
}
