package net.cloudjob.core.service;

import net.cloudjob.core.model.CronJobDefinition;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.spi.TxRunner;
import net.cloudjob.core.support.FixedCron;
import net.cloudjob.core.support.InMemoryJobStore;
import net.cloudjob.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class JobCreatorTest {

    static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    MutableClock clock;
    InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0.plusSeconds(30));
        store = new InMemoryJobStore();
    }

    JobCreator creator(CronJobDefinition... defs) {
        return new JobCreator(store, TxRunner.direct(), clock, new FixedCron(), ZoneOffset.UTC,
                List.of(defs), JobCreator.DEFAULT_FIRST_RUN_GRACE);
    }

    static CronJobDefinition def(String name, String cron) {
        return new CronJobDefinition(name, "fetch papers", JobType.PAPER_FETCH, cron,
                Map.of("query", "llm"), 2, true);
    }

    @Test
    void firstRun_withinGrace_createsOnce_thenEachNewSlot() {
        JobCreator c = creator(def("daily", "every:60"));

        assertEquals(1, c.createDueJobs());
        assertEquals(0, c.createDueJobs(), "same slot must not fire twice");

        clock.advance(Duration.ofSeconds(60));
        assertEquals(1, c.createDueJobs());
        assertEquals(2, store.all().size());
        assertEquals(2, c.created());
    }

    @Test
    void firstRun_outsideGrace_waitsForNextSlot() {
        clock.set(T0.plus(Duration.ofMinutes(10)));
        JobCreator c = creator(def("hourly", "every:3600"));

        assertEquals(0, c.createDueJobs());

        clock.set(T0.plus(Duration.ofMinutes(61)));
        assertEquals(1, c.createDueJobs());
    }

    @Test
    void materializedJob_carriesDefinition() {
        creator(def("fetch", "every:60")).createDueJobs();

        Job job = store.all().get(0);
        assertEquals("fetch_20240501_000030", job.name());
        assertEquals("fetch papers (Auto-created by cron: every:60)", job.description());
        assertEquals(JobType.PAPER_FETCH, job.jobType());
        assertEquals(JobStatus.WAITING, job.status());
        assertEquals(2, job.maxRetries());
        assertEquals(0, job.currentRetries());
        assertEquals(Map.of("query", "llm"), job.config());
        assertEquals(clock.now(), job.createdAt());
        assertFalse(job.locked());
    }

    @Test
    void invalidDefinitions_areSkipped_othersStillRun() {
        var badCron = def("bad-cron", "not a cron");
        var badType = new CronJobDefinition("bad-type", "", JobType.UNKNOWN, "every:60", Map.of(), 1, true);
        var good = def("good", "every:60");

        JobCreator c = creator(badCron, badType, good);

        assertThat(c.definitions()).extracting(CronJobDefinition::name).containsExactly("good");
        assertEquals(1, c.createDueJobs());
    }

    @Test
    void disabledDefinition_neverFires() {
        var off = new CronJobDefinition("off", "", JobType.CUSTOM, "every:60", Map.of(), 1, false);
        JobCreator c = creator(off);

        assertEquals(0, c.createDueJobs());
        clock.advance(Duration.ofMinutes(5));
        assertEquals(0, c.createDueJobs());
    }

    @Test
    void storeFailure_isCounted_andRetriedNextTick() {
        JobCreator c = creator(def("flaky", "every:60"));
        store.setUnavailable(true);

        assertEquals(0, c.createDueJobs());
        assertEquals(1, c.errors());

        store.setUnavailable(false);
        assertEquals(1, c.createDueJobs(), "slot was not consumed by the failed insert");
    }

    @Test
    void submit_insertsWaitingJob() throws Exception {
        JobCreator c = creator();

        Job job = c.submit("manual", JobType.CUSTOM, Map.of("a", 1), 4, "by hand");

        Job stored = store.findById(job.jobId()).orElseThrow();
        assertEquals(JobStatus.WAITING, stored.status());
        assertEquals(4, stored.maxRetries());
        assertEquals("by hand", stored.description());
    }

    @Test
    void submit_rejectsBadArguments() {
        JobCreator c = creator();

        assertThatThrownBy(() -> c.submit(" ", JobType.CUSTOM, Map.of(), 1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.submit("x", JobType.UNKNOWN, Map.of(), 1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> c.submit("x", JobType.CUSTOM, Map.of(), -1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
