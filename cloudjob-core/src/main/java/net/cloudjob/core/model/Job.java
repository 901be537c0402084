package net.cloudjob.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record Job(
        String jobId,
        String name,
        String description,
        JobType jobType,
        Map<String, Object> config,
        JobStatus status,
        int maxRetries,
        int currentRetries,
        String lockedBy,        // null = 미잠금
        Instant lockedAt,
        Instant lockExpiresAt,  // 항상 lockedAt + lease
        Instant notBefore,      // 재시도 백오프. null = 즉시 가능
        Instant lastExecution,
        Instant createdAt
) {
    public Job {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        if (currentRetries < 0 || currentRetries > maxRetries) {
            throw new IllegalArgumentException("currentRetries out of range: " + currentRetries + "/" + maxRetries);
        }
    }

    public static Job ofNew(String name, String description, JobType jobType,
                            Map<String, Object> config, int maxRetries, Instant createdAt) {
        return new Job(UUID.randomUUID().toString(), name, description, jobType, config,
                JobStatus.WAITING, maxRetries, 0, null, null, null, null, null, createdAt);
    }

    public boolean locked() {
        return status == JobStatus.LOCKED && lockedBy != null && lockExpiresAt != null;
    }

    public boolean hasRetryBudget() {
        return currentRetries < maxRetries;
    }

    /** WAITING 이거나, 재시도 여유가 남은 FAILED (+ 백오프 경과) */
    public boolean eligibleAt(Instant now) {
        boolean byStatus = status == JobStatus.WAITING || (status == JobStatus.FAILED && hasRetryBudget());
        return byStatus && (notBefore == null || !notBefore.isAfter(now));
    }
}
