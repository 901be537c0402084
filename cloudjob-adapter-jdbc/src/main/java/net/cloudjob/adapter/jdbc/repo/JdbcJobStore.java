package net.cloudjob.adapter.jdbc.repo;

import net.cloudjob.adapter.jdbc.JdbcUtil;
import net.cloudjob.adapter.jdbc.TxContext;
import net.cloudjob.adapter.jdbc.mapper.RowMappers;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatistics;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.spi.JobStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 임베디드(SQLite) 저장소. 모든 호출은 TxContext 커넥션 위에서 돈다.
 * 경합은 BEGIN IMMEDIATE(단일 writer) + WHERE 절의 상태 재확인 두 겹으로 막는다.
 */
public final class JdbcJobStore implements JobStore {

    private static final String COLUMNS = """
            JOB_ID, NAME, DESCRIPTION, JOB_TYPE, CONFIG, STATUS, MAX_RETRIES, CURRENT_RETRIES,
            LOCKED_BY, LOCKED_AT, LOCK_EXPIRES_AT, NOT_BEFORE, LAST_EXECUTION, CREATED_AT""";

    @Override
    public List<Job> findEligible(Instant now, int limit) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + """

                  FROM TB_CLOUD_JOB
                 WHERE (STATUS = 'waiting' OR (STATUS = 'failed' AND CURRENT_RETRIES < MAX_RETRIES))
                   AND (NOT_BEFORE IS NULL OR NOT_BEFORE <= ?)
                 ORDER BY CASE STATUS WHEN 'waiting' THEN 0 ELSE 1 END, CREATED_AT, ROWID
                 LIMIT ?
                """)) {
            JdbcUtil.setMillis(ps, 1, now);
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public Optional<Job> lock(Job candidate, String owner, Instant lockedAt, Instant expiresAt) throws Exception {
        Connection c = TxContext.required();
        int updated;
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_CLOUD_JOB
                   SET STATUS = 'locked', LOCKED_BY = ?, LOCKED_AT = ?, LOCK_EXPIRES_AT = ?
                 WHERE JOB_ID = ?
                   AND STATUS = ?
                   AND CURRENT_RETRIES = ?
                """)) {
            ps.setString(1, owner);
            JdbcUtil.setMillis(ps, 2, lockedAt);
            JdbcUtil.setMillis(ps, 3, expiresAt);
            ps.setString(4, candidate.jobId());
            ps.setString(5, candidate.status().code());
            ps.setInt(6, candidate.currentRetries());
            updated = ps.executeUpdate();
        }
        // 0건이면 그 사이 다른 보유자가 상태를 바꾼 것
        if (updated != 1) return Optional.empty();
        return findById(candidate.jobId());
    }

    @Override
    public boolean complete(String jobId, String owner, JobStatus next, int currentRetries,
                            Instant executedAt, Instant notBefore) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_CLOUD_JOB
                   SET STATUS = ?, CURRENT_RETRIES = ?,
                       LOCKED_BY = NULL, LOCKED_AT = NULL, LOCK_EXPIRES_AT = NULL,
                       NOT_BEFORE = ?, LAST_EXECUTION = ?
                 WHERE JOB_ID = ?
                   AND STATUS = 'locked'
                   AND LOCKED_BY = ?
                """)) {
            ps.setString(1, next.code());
            ps.setInt(2, currentRetries);
            JdbcUtil.setMillis(ps, 3, notBefore);
            JdbcUtil.setMillis(ps, 4, executedAt);
            ps.setString(5, jobId);
            ps.setString(6, owner);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<String> releaseExpired(Instant now) throws Exception {
        Connection c = TxContext.required();
        List<String> expired = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT JOB_ID
                  FROM TB_CLOUD_JOB
                 WHERE STATUS = 'locked'
                   AND LOCK_EXPIRES_AT < ?
                 ORDER BY LOCK_EXPIRES_AT
                """)) {
            JdbcUtil.setMillis(ps, 1, now);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) expired.add(rs.getString(1));
            }
        }

        List<String> released = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_CLOUD_JOB
                   SET STATUS = CASE WHEN CURRENT_RETRIES < MAX_RETRIES THEN 'waiting' ELSE 'failed' END,
                       LOCKED_BY = NULL, LOCKED_AT = NULL, LOCK_EXPIRES_AT = NULL
                 WHERE JOB_ID = ?
                   AND STATUS = 'locked'
                   AND LOCK_EXPIRES_AT < ?
                """)) {
            for (String id : expired) {
                ps.setString(1, id);
                JdbcUtil.setMillis(ps, 2, now);
                if (ps.executeUpdate() == 1) released.add(id);
            }
        }
        return released;
    }

    @Override
    public Job insert(Job job) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO TB_CLOUD_JOB (" + COLUMNS + """
                )
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            ps.setString(1, job.jobId());
            ps.setString(2, job.name());
            ps.setString(3, job.description() == null ? "" : job.description());
            ps.setString(4, job.jobType().code());
            ps.setString(5, JdbcUtil.toJson(job.config()));
            ps.setString(6, job.status().code());
            ps.setInt(7, job.maxRetries());
            ps.setInt(8, job.currentRetries());
            ps.setString(9, job.lockedBy());
            JdbcUtil.setMillis(ps, 10, job.lockedAt());
            JdbcUtil.setMillis(ps, 11, job.lockExpiresAt());
            JdbcUtil.setMillis(ps, 12, job.notBefore());
            JdbcUtil.setMillis(ps, 13, job.lastExecution());
            JdbcUtil.setMillis(ps, 14, job.createdAt());
            ps.executeUpdate();
        }
        return job;
    }

    @Override
    public Optional<Job> findById(String jobId) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM TB_CLOUD_JOB WHERE JOB_ID = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status, int limit) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + """

                  FROM TB_CLOUD_JOB
                 WHERE STATUS = ?
                 ORDER BY CREATED_AT, ROWID
                 LIMIT ?
                """)) {
            ps.setString(1, status.code());
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public JobStatistics statistics() throws Exception {
        Connection c = TxContext.required();
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        long total = 0;
        try (PreparedStatement ps = c.prepareStatement("SELECT STATUS, COUNT(*) FROM TB_CLOUD_JOB GROUP BY STATUS");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long n = rs.getLong(2);
                counts.merge(JobStatus.from(rs.getString(1)), n, Long::sum);
                total += n;
            }
        }
        return new JobStatistics(total,
                counts.getOrDefault(JobStatus.WAITING, 0L),
                counts.getOrDefault(JobStatus.LOCKED, 0L),
                counts.getOrDefault(JobStatus.SUCCESS, 0L),
                counts.getOrDefault(JobStatus.FAILED, 0L),
                counts.getOrDefault(JobStatus.DISABLED, 0L));
    }

    private static List<Job> list(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }
}
