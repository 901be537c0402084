package net.cloudjob.adapter.rest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.model.JobType;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/** cloud_jobs 행의 wire 표현 (snake_case, timestamptz) */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record JobRow(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("status") String status,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("current_retries") Integer currentRetries,
        @JsonProperty("locked_by") String lockedBy,
        @JsonProperty("locked_at") OffsetDateTime lockedAt,
        @JsonProperty("lock_expires_at") OffsetDateTime lockExpiresAt,
        @JsonProperty("not_before") @JsonInclude(JsonInclude.Include.NON_NULL) OffsetDateTime notBefore,
        @JsonProperty("last_execution") OffsetDateTime lastExecution,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static JobRow from(Job j) {
        return new JobRow(j.jobId(), j.name(), j.description(), j.jobType().code(), j.config(),
                j.status().code(), j.maxRetries(), j.currentRetries(), j.lockedBy(),
                odt(j.lockedAt()), odt(j.lockExpiresAt()), odt(j.notBefore()),
                odt(j.lastExecution()), odt(j.createdAt()));
    }

    public Job toJob() {
        return new Job(jobId, name, description == null ? "" : description, JobType.from(jobType), config,
                JobStatus.from(status), maxRetries == null ? 0 : maxRetries,
                currentRetries == null ? 0 : currentRetries, lockedBy,
                instant(lockedAt), instant(lockExpiresAt), instant(notBefore),
                instant(lastExecution), instant(createdAt));
    }

    static OffsetDateTime odt(Instant i) {
        return i == null ? null : i.atOffset(ZoneOffset.UTC);
    }

    static Instant instant(OffsetDateTime t) {
        return t == null ? null : t.toInstant();
    }
}
