package net.cloudjob.bootstrap.autoconfigure;

import net.cloudjob.adapter.rest.RestJobStore;
import net.cloudjob.bootstrap.catalog.CronCatalogLoader;
import net.cloudjob.bootstrap.props.CloudJobProperties;
import net.cloudjob.core.scheduler.SchedulerCoordinator;
import net.cloudjob.core.scheduler.SchedulerInstance;
import net.cloudjob.core.service.*;
import net.cloudjob.core.spi.*;
import net.cloudjob.integration.spring.CloudJobJdbcConfig;
import net.cloudjob.integration.spring.CloudJobSpringConfig;
import net.cloudjob.integration.spring.lifecycle.SchedulerLifecycle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.ZoneId;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"
})
@EnableConfigurationProperties(CloudJobProperties.class)
@Import(CloudJobSpringConfig.class) // integration-spring: clock/cron wiring
public class CloudJobAutoConfiguration {

    // --- 저장소 선택 (기동 시 한 번) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cloudjob.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    @Import(CloudJobJdbcConfig.class)
    static class JdbcStoreConfiguration {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cloudjob.store", name = "type", havingValue = "rest")
    static class RestStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public TxRunner txRunner() {
            return TxRunner.direct();
        }

        @Bean
        @ConditionalOnMissingBean
        public JobStore jobStore(CloudJobProperties props) {
            var rest = props.getStore().getRest();
            Duration backoff = props.getScheduler().getRetryBackoff();
            boolean notBefore = backoff != null && !backoff.isZero() && !backoff.isNegative();
            return RestJobStore.create(rest.getUrl(), rest.getApiKey(), rest.getTable(), rest.getTimeout(), notBefore);
        }
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerInstance schedulerInstance(CloudJobProperties props) {
        var s = props.getScheduler();
        return new SchedulerInstance(SchedulerInstance.newInstanceId(s.getInstancePrefix()), s.getLease(),
                s.getExecutorInterval(), s.getCreatorInterval(), s.getReaperInterval(), s.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(CloudJobProperties props) {
        var s = props.getScheduler();
        return RetryPolicy.exponential(s.getRetryBackoff(), s.getRetryBackoffMax());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobPicker jobPicker(JobStore store, TxRunner tx, Clock clock, SchedulerInstance instance,
                               RetryPolicy retry, CloudJobProperties props) {
        return new JobPicker(store, tx, clock, instance, retry, props.getScheduler().getCandidateBatch());
    }

    @Bean
    @ConditionalOnMissingBean
    public LockReaper lockReaper(JobPicker picker) {
        return new LockReaper(picker);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCreator jobCreator(JobStore store, TxRunner tx, Clock clock, CronCalculator cron,
                                 CloudJobProperties props) {
        return new JobCreator(store, tx, clock, cron, ZoneId.of(props.getZone()),
                CronCatalogLoader.load(props.getCatalog()), props.getScheduler().getFirstRunGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDispatcher jobDispatcher(ObjectProvider<JobHandler> handlers) {
        return new JobDispatcher(handlers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerCoordinator schedulerCoordinator(SchedulerInstance instance, JobPicker picker, JobCreator creator,
                                                     LockReaper reaper, JobDispatcher dispatcher, Clock clock) {
        return new SchedulerCoordinator(instance, picker, creator, reaper, dispatcher, clock);
    }

    // --- 루프 기동 (프로퍼티로 끌 수 있음) ---

    @Bean
    @ConditionalOnProperty(prefix = "cloudjob.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(SchedulerCoordinator coordinator) {
        return new SchedulerLifecycle(coordinator);
    }
}
