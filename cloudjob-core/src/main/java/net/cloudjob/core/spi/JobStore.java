package net.cloudjob.core.spi;

import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatistics;
import net.cloudjob.core.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * jobs 테이블 접근 SPI.
 * 임베디드 구현은 TxRunner 트랜잭션 안에서, 호스티드 구현은 조건부 업데이트로 원자성을 보장한다.
 */
public interface JobStore {

    /** 픽업 순서대로: WAITING 먼저, 그 다음 재시도 여유가 있는 FAILED. 각 그룹은 created_at 오름차순 */
    List<Job> findEligible(Instant now, int limit) throws Exception;

    /**
     * 조건부 잠금: job_id + 후보의 status/current_retries 가 그대로일 때만 LOCKED 전환.
     * 영향 행이 0이면 경합에서 진 것이므로 empty.
     */
    Optional<Job> lock(Job candidate, String owner, Instant lockedAt, Instant expiresAt) throws Exception;

    /**
     * 잠금 해제 + 결과 반영. status=LOCKED AND locked_by=owner 일 때만 적용.
     * false 면 리스를 이미 잃은 것(리퍼가 회수했거나 다른 인스턴스가 다시 잡음).
     */
    boolean complete(String jobId, String owner, JobStatus next, int currentRetries,
                     Instant executedAt, Instant notBefore) throws Exception;

    /** lock_expires_at < now 인 LOCKED 를 WAITING(여유 있음) / FAILED 로 되돌리고, 실제로 풀린 job_id 반환 */
    List<String> releaseExpired(Instant now) throws Exception;

    Job insert(Job job) throws Exception;

    Optional<Job> findById(String jobId) throws Exception;

    List<Job> findByStatus(JobStatus status, int limit) throws Exception;

    JobStatistics statistics() throws Exception;
}
