package net.cloudjob.integration.spring;

import net.cloudjob.adapter.jdbc.repo.JdbcJobStore;
import net.cloudjob.core.spi.JobStore;
import net.cloudjob.core.spi.TxRunner;
import net.cloudjob.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** 임베디드 저장소 조립 (adapter-jdbc 재사용) */
@Configuration(proxyBeanMethods = false)
public class CloudJobJdbcConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public JobStore jobStore() { return new JdbcJobStore(); }
}
