package net.cloudjob.integration.spring.lifecycle;

import com.zaxxer.hikari.HikariDataSource;
import net.cloudjob.core.model.ExecutionResult;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.scheduler.SchedulerCoordinator;
import net.cloudjob.core.scheduler.SchedulerInstance;
import net.cloudjob.core.service.JobCreator;
import net.cloudjob.core.service.JobDispatcher;
import net.cloudjob.core.service.JobPicker;
import net.cloudjob.core.service.LockReaper;
import net.cloudjob.core.spi.Clock;
import net.cloudjob.core.spi.CronCalculator;
import net.cloudjob.core.spi.JobHandler;
import net.cloudjob.core.spi.JobStore;
import net.cloudjob.core.spi.TxRunner;
import net.cloudjob.integration.spring.CloudJobJdbcConfig;
import net.cloudjob.integration.spring.CloudJobSpringConfig;
import net.cloudjob.integration.spring.SqliteSupport;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class SchedulerLifecycleTest {

    @Configuration(proxyBeanMethods = false)
    @Import({CloudJobSpringConfig.class, CloudJobJdbcConfig.class})
    static class TestConfig {
        @Bean(destroyMethod = "close")
        HikariDataSource dataSource() throws Exception {
            return SqliteSupport.migratedDataSource(SqliteSupport.tempDir());
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource ds) {
            return new DataSourceTransactionManager(ds);
        }

        @Bean
        SchedulerInstance schedulerInstance() {
            return new SchedulerInstance(SchedulerInstance.newInstanceId("lifecycle"), Duration.ofMinutes(30),
                    Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofSeconds(5));
        }

        @Bean
        JobPicker jobPicker(JobStore store, TxRunner tx, Clock clock, SchedulerInstance instance) {
            return new JobPicker(store, tx, clock, instance);
        }

        @Bean
        JobCreator jobCreator(JobStore store, TxRunner tx, Clock clock, CronCalculator cron) {
            return new JobCreator(store, tx, clock, cron, ZoneOffset.UTC, List.of(), Duration.ofMinutes(5));
        }

        @Bean
        SchedulerCoordinator coordinator(SchedulerInstance instance, JobPicker picker, JobCreator creator, Clock clock) {
            JobHandler echo = new JobHandler() {
                @Override public JobType type() { return JobType.CUSTOM; }
                @Override public ExecutionResult execute(Map<String, Object> config) {
                    return ExecutionResult.success(config);
                }
            };
            return new SchedulerCoordinator(instance, picker, creator, new LockReaper(picker),
                    new JobDispatcher(List.of(echo)), clock);
        }

        @Bean
        SchedulerLifecycle schedulerLifecycle(SchedulerCoordinator coordinator) {
            return new SchedulerLifecycle(coordinator);
        }
    }

    @Test
    void contextStartsAndStopsCoordinator() throws Exception {
        SchedulerCoordinator coordinator;
        try (var ctx = new AnnotationConfigApplicationContext(TestConfig.class)) {
            coordinator = ctx.getBean(SchedulerCoordinator.class);
            assertTrue(coordinator.isRunning(), "lifecycle starts the coordinator on refresh");

            JobCreator creator = ctx.getBean(JobCreator.class);
            JobStore store = ctx.getBean(JobStore.class);
            TxRunner tx = ctx.getBean(TxRunner.class);
            Job job = creator.submit("spring-job", JobType.CUSTOM, Map.of("x", 1), 1, "via lifecycle");

            await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                    assertEquals(JobStatus.SUCCESS, tx.required(() -> store.findById(job.jobId())).orElseThrow().status()));
            assertTrue(coordinator.isHealthy());
        }
        assertFalse(coordinator.isRunning(), "context close stops the loops");
    }
}
