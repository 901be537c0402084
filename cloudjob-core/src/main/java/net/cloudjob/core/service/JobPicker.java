package net.cloudjob.core.service;

import net.cloudjob.core.model.ExecutionResult;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatistics;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.scheduler.SchedulerInstance;
import net.cloudjob.core.spi.Clock;
import net.cloudjob.core.spi.JobStore;
import net.cloudjob.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 잡 선점/완료/리스 회수 프로토콜.
 * <ul>
 *   <li>선점: 후보를 픽업 순서대로 읽고 조건부 잠금. 경합에서 지면 다음 후보로 넘어간다.</li>
 *   <li>완료: 성공이면 SUCCESS, 실패면 재시도 여유에 따라 WAITING(+1) 또는 FAILED.</li>
 *   <li>회수: lock_expires_at 이 지난 LOCKED 를 되돌린다. 재시도 횟수는 소모하지 않음.</li>
 * </ul>
 */
public final class JobPicker {
    private static final Logger log = LoggerFactory.getLogger(JobPicker.class);

    public static final int DEFAULT_CANDIDATE_BATCH = 5;

    private final JobStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerInstance instance;
    private final RetryPolicy retry;
    private final int candidateBatch;

    public JobPicker(JobStore store, TxRunner tx, Clock clock, SchedulerInstance instance) {
        this(store, tx, clock, instance, RetryPolicy.immediate(), DEFAULT_CANDIDATE_BATCH);
    }

    public JobPicker(JobStore store, TxRunner tx, Clock clock, SchedulerInstance instance,
                     RetryPolicy retry, int candidateBatch) {
        if (candidateBatch < 1) throw new IllegalArgumentException("candidateBatch must be >= 1");
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.instance = instance;
        this.retry = retry;
        this.candidateBatch = candidateBatch;
    }

    /** 다음 적격 잡을 잠그고 반환. 없거나 모든 후보를 경합에서 졌으면 empty */
    public Optional<Job> getNextJob() throws Exception {
        Instant now = clock.now();
        Instant expiresAt = now.plus(instance.lease());
        String owner = instance.instanceId();

        Optional<Job> picked = tx.requiresNew(() -> {
            for (Job candidate : store.findEligible(now, candidateBatch)) {
                Optional<Job> locked = store.lock(candidate, owner, now, expiresAt);
                if (locked.isPresent()) return locked;
                log.debug("Lost race for job {} ({})", candidate.jobId(), candidate.status().code());
            }
            return Optional.<Job>empty();
        });

        picked.ifPresent(j -> log.info("Picked job {} ({}, type={}, retries={}/{})",
                j.jobId(), j.name(), j.jobType().code(), j.currentRetries(), j.maxRetries()));
        return picked;
    }

    public boolean completeJob(Job job, boolean success, Map<String, Object> result, String error) throws Exception {
        return completeJob(job, new ExecutionResult(success, result, error));
    }

    /**
     * 결과 반영. 리스를 잃은 상태(리퍼가 회수했거나 다른 인스턴스가 재선점)면 아무것도 쓰지 않고 false.
     */
    public boolean completeJob(Job job, ExecutionResult result) throws Exception {
        Instant now = clock.now();

        final JobStatus next;
        final int retries;
        Instant notBefore = null;
        if (result.success()) {
            next = JobStatus.SUCCESS;
            retries = job.currentRetries();
        } else if (job.hasRetryBudget()) {
            next = JobStatus.WAITING;
            retries = job.currentRetries() + 1;
            Duration backoff = retry.nextBackoff(retries);
            if (backoff != null && !backoff.isZero() && !backoff.isNegative()) {
                notBefore = now.plus(backoff);
            }
        } else {
            next = JobStatus.FAILED;
            retries = job.currentRetries();
        }
        final Instant nb = notBefore;

        boolean applied = tx.requiresNew(() ->
                store.complete(job.jobId(), instance.instanceId(), next, retries, now, nb));

        if (!applied) {
            log.warn("Lease lost for job {} ({}); result discarded", job.jobId(), job.name());
        } else if (result.success()) {
            log.info("Job {} ({}) completed", job.jobId(), job.name());
        } else if (next == JobStatus.WAITING) {
            log.info("Job {} ({}) failed, retry {}/{}{}: {}", job.jobId(), job.name(), retries, job.maxRetries(),
                    nb == null ? "" : " not before " + nb, result.error());
        } else {
            log.warn("Job {} ({}) failed permanently after {} retries: {}",
                    job.jobId(), job.name(), retries, result.error());
        }
        return applied;
    }

    /** 만료된 잠금을 풀고 풀린 job_id 목록을 반환 */
    public List<String> releaseExpiredLocks() throws Exception {
        Instant now = clock.now();
        List<String> released = tx.requiresNew(() -> store.releaseExpired(now));
        if (!released.isEmpty()) {
            log.info("Released {} expired lock(s): {}", released.size(), released);
        }
        return released;
    }

    public JobStatistics getStatistics() throws Exception {
        return tx.required(store::statistics);
    }
}
