package net.cloudjob.core.scheduler;

import net.cloudjob.core.model.ExecutionResult;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatistics;
import net.cloudjob.core.service.JobCreator;
import net.cloudjob.core.service.JobDispatcher;
import net.cloudjob.core.service.JobPicker;
import net.cloudjob.core.service.LockReaper;
import net.cloudjob.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 세 개의 독립 루프(executor / creator / reaper)를 소유한다.
 * 루프끼리는 상태를 공유하지 않고 jobs 테이블만 공유한다. 코디네이터는 행을 직접 쓰지 않는다.
 */
public final class SchedulerCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SchedulerCoordinator.class);

    private final SchedulerInstance instance;
    private final JobPicker picker;
    private final JobCreator creator;
    private final LockReaper reaper;
    private final JobDispatcher dispatcher;
    private final Clock clock;

    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile Job inFlight;
    private List<PeriodicLoop> loops = List.of();
    private boolean running;

    public SchedulerCoordinator(SchedulerInstance instance, JobPicker picker, JobCreator creator,
                                LockReaper reaper, JobDispatcher dispatcher, Clock clock) {
        this.instance = instance;
        this.picker = picker;
        this.creator = creator;
        this.reaper = reaper;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler {} already running", instance.instanceId());
            return;
        }
        loops = List.of(
                new PeriodicLoop("executor", instance.executorInterval(), this::executeNext, clock),
                new PeriodicLoop("creator", instance.creatorInterval(), () -> {
                    creator.createDueJobs();
                    return false;
                }, clock),
                new PeriodicLoop("reaper", instance.reaperInterval(), () -> {
                    reaper.reapOnce();
                    return false;
                }, clock));
        loops.forEach(PeriodicLoop::start);
        running = true;
        log.info("Scheduler {} started (lease={}, executor={}, creator={}, reaper={})",
                instance.instanceId(), instance.lease(), instance.executorInterval(),
                instance.creatorInterval(), instance.reaperInterval());
    }

    /**
     * 모든 루프에 정지 신호 → 각 루프를 shutdownTimeout 까지 기다린다. 진행 중인 페이로드는 끝까지 돈다.
     * 시간 안에 끝나지 않은 페이로드는 버려지고(완료 기록이 실패할 수 있다) 그 잡은 lease 만료 후 reaper 가 회수한다.
     */
    public synchronized void stop() {
        if (!running) return;
        log.info("Stopping scheduler {}", instance.instanceId());
        loops.forEach(PeriodicLoop::signalStop);
        for (PeriodicLoop loop : loops) {
            try {
                if (!loop.join(instance.shutdownTimeout())) {
                    log.warn("{} loop did not stop within {}", loop.name(), instance.shutdownTimeout());
                    Job job = inFlight;
                    if (loop.name().equals("executor") && job != null) {
                        log.warn("Job {} ({}) left in flight; its lease expires at {} and the reaper will reclaim it",
                                job.jobId(), job.name(), job.lockExpiresAt());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping {} loop", loop.name());
                break;
            }
        }
        running = false;
        log.info("Scheduler {} stopped", instance.instanceId());
    }

    /** 한 번의 executor tick. 잡을 처리했으면 true(바로 다음 잡 시도) */
    boolean executeNext() throws Exception {
        Optional<Job> next = picker.getNextJob();
        if (next.isEmpty()) return false;

        Job job = next.get();
        inFlight = job;
        try {
            executed.incrementAndGet();
            ExecutionResult result = dispatcher.execute(job);
            if (result.success()) succeeded.incrementAndGet();
            else failed.incrementAndGet();
            picker.completeJob(job, result);
        } finally {
            inFlight = null;
        }
        return true;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized boolean isHealthy() {
        if (!running) return false;
        Instant now = clock.now();
        return loops.stream().allMatch(l -> l.isHealthy(now));
    }

    public synchronized SchedulerStatus status() {
        Instant now = clock.now();
        JobStatistics stats = null;
        try {
            stats = picker.getStatistics();
        } catch (Exception e) {
            log.warn("Failed to read job statistics", e);
        }
        var loopStatuses = loops.stream().map(l -> l.status(now)).toList();
        boolean healthy = running && loopStatuses.stream().allMatch(PeriodicLoop.LoopStatus::healthy);
        return new SchedulerStatus(instance.instanceId(), running, healthy, loopStatuses,
                executed.get(), succeeded.get(), failed.get(),
                creator.created(), creator.errors(), reaper.released(), stats);
    }

    /** executor 가 지금 실행 중인 잡 */
    public Optional<Job> inFlight() {
        return Optional.ofNullable(inFlight);
    }

    public SchedulerInstance instance() {
        return instance;
    }
}
