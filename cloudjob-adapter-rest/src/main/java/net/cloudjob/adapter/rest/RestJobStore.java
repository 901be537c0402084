package net.cloudjob.adapter.rest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatistics;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.spi.JobStore;
import net.cloudjob.core.spi.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 호스티드(PostgREST) 저장소. 트랜잭션이 없으므로 모든 쓰기는 조건부 PATCH 이고,
 * Prefer: return=representation 으로 돌려받은 행 수가 승패를 가른다.
 * <p>
 * PostgREST 필터로는 컬럼끼리 비교(current_retries &lt; max_retries)가 안 돼서 FAILED 후보는
 * 좁은 컬럼만 받아서 거르고, 남은 행만 전체 컬럼으로 다시 읽는다.
 * <p>
 * not_before 컬럼은 재시도 백오프를 켤 때만 읽고 쓴다. 스키마는 db/migration/postgres 참고.
 */
public final class RestJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RestJobStore.class);

    public static final String DEFAULT_TABLE = "cloud_jobs";
    static final int PAGE_SIZE = 200;
    static final String RETRY_COLUMNS = "job_id,status,current_retries,max_retries,created_at";

    private final RestTemplate rest;
    private final String baseUrl;
    private final String table;
    private final boolean notBefore;

    public RestJobStore(RestTemplate rest, String baseUrl, String table) {
        this(rest, baseUrl, table, false);
    }

    /** @param notBefore true 면 not_before 컬럼으로 백오프를 관리한다 */
    public RestJobStore(RestTemplate rest, String baseUrl, String table, boolean notBefore) {
        this.rest = rest;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.table = table;
        this.notBefore = notBefore;
    }

    public static RestJobStore create(String baseUrl, String apiKey, String table, Duration timeout,
                                      boolean notBefore) {
        if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("store url is required");
        return new RestJobStore(restTemplate(apiKey, timeout), baseUrl, table, notBefore);
    }

    public boolean tracksNotBefore() {
        return notBefore;
    }

    /** apikey / Authorization 헤더를 붙이는 RestTemplate */
    public static RestTemplate restTemplate(String apiKey, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) throw new IllegalArgumentException("api key is required");

        var factory = new JdkClientHttpRequestFactory(HttpClient.newBuilder().connectTimeout(timeout).build());
        factory.setReadTimeout(timeout);

        var rt = new RestTemplate(List.of(new MappingJackson2HttpMessageConverter(objectMapper())));
        rt.setRequestFactory(factory);
        rt.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().set("apikey", apiKey);
            request.getHeaders().setBearerAuth(apiKey);
            return execution.execute(request, body);
        });
        return rt;
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<Job> findEligible(Instant now, int limit) {
        List<Job> out = new ArrayList<>();
        for (JobRow row : get(q -> {
            q.queryParam("status", "eq." + JobStatus.WAITING.code());
            notBeforeFilter(q, now);
            q.queryParam("order", "created_at.asc,job_id.asc").queryParam("limit", limit);
        })) {
            out.add(row.toJob());
        }
        if (out.size() >= limit) return out;

        // 소진된 FAILED 행은 계속 쌓이므로 예산 판정에 필요한 컬럼만 훑는다
        List<String> retryable = new ArrayList<>();
        int offset = 0;
        while (out.size() + retryable.size() < limit) {
            final int from = offset;
            JobRow[] page = get(q -> {
                q.queryParam("select", RETRY_COLUMNS)
                        .queryParam("status", "eq." + JobStatus.FAILED.code());
                notBeforeFilter(q, now);
                q.queryParam("order", "created_at.asc,job_id.asc")
                        .queryParam("limit", PAGE_SIZE)
                        .queryParam("offset", from);
            });
            for (JobRow row : page) {
                if (hasBudget(row) && out.size() + retryable.size() < limit) retryable.add(row.jobId());
            }
            if (page.length < PAGE_SIZE) break;
            offset += PAGE_SIZE;
        }
        if (retryable.isEmpty()) return out;

        for (JobRow row : get(q -> q
                .queryParam("job_id", "in.(" + String.join(",", retryable) + ")")
                .queryParam("status", "eq." + JobStatus.FAILED.code())
                .queryParam("order", "created_at.asc,job_id.asc"))) {
            Job j = row.toJob();
            if (j.hasRetryBudget()) out.add(j);
        }
        return out;
    }

    private void notBeforeFilter(UriComponentsBuilder q, Instant now) {
        if (notBefore) q.queryParam("or", "(not_before.is.null,not_before.lte." + now + ")");
    }

    private static boolean hasBudget(JobRow row) {
        int retries = row.currentRetries() == null ? 0 : row.currentRetries();
        int max = row.maxRetries() == null ? 0 : row.maxRetries();
        return retries < max;
    }

    @Override
    public Optional<Job> lock(Job candidate, String owner, Instant lockedAt, Instant expiresAt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", JobStatus.LOCKED.code());
        body.put("locked_by", owner);
        body.put("locked_at", JobRow.odt(lockedAt));
        body.put("lock_expires_at", JobRow.odt(expiresAt));

        JobRow[] rows = patch(q -> q
                .queryParam("job_id", "eq." + candidate.jobId())
                .queryParam("status", "eq." + candidate.status().code())
                .queryParam("current_retries", "eq." + candidate.currentRetries()), body);
        if (rows.length == 0) {
            log.debug("Conditional lock matched no row for job {}", candidate.jobId());
            return Optional.empty();
        }
        return Optional.of(rows[0].toJob());
    }

    @Override
    public boolean complete(String jobId, String owner, JobStatus next, int currentRetries,
                            Instant executedAt, Instant notBefore) {
        Map<String, Object> body = unlockBody(next);
        body.put("current_retries", currentRetries);
        if (this.notBefore) body.put("not_before", JobRow.odt(notBefore));
        body.put("last_execution", JobRow.odt(executedAt));

        JobRow[] rows = patch(q -> q
                .queryParam("job_id", "eq." + jobId)
                .queryParam("status", "eq." + JobStatus.LOCKED.code())
                .queryParam("locked_by", "eq." + owner), body);
        return rows.length == 1;
    }

    @Override
    public List<String> releaseExpired(Instant now) {
        JobRow[] expired = get(q -> q
                .queryParam("select", "job_id,current_retries,max_retries")
                .queryParam("status", "eq." + JobStatus.LOCKED.code())
                .queryParam("lock_expires_at", "lt." + now)
                .queryParam("order", "lock_expires_at.asc"));

        List<String> released = new ArrayList<>();
        for (JobRow row : expired) {
            JobStatus next = hasBudget(row) ? JobStatus.WAITING : JobStatus.FAILED;

            // 보유자가 그 사이 완료했으면 status/lock_expires_at 조건에서 걸러진다
            JobRow[] rows = patch(q -> q
                    .queryParam("job_id", "eq." + row.jobId())
                    .queryParam("status", "eq." + JobStatus.LOCKED.code())
                    .queryParam("lock_expires_at", "lt." + now), unlockBody(next));
            if (rows.length == 1) released.add(row.jobId());
        }
        return released;
    }

    @Override
    public Job insert(Job job) {
        URI uri = uri(q -> { });
        JobRow[] rows = call(() -> rest.exchange(uri, HttpMethod.POST,
                new HttpEntity<>(JobRow.from(job), writeHeaders()), JobRow[].class).getBody());
        if (rows == null || rows.length == 0) {
            throw new JobStoreException("Insert returned no row for job " + job.jobId(), null);
        }
        return rows[0].toJob();
    }

    @Override
    public Optional<Job> findById(String jobId) {
        JobRow[] rows = get(q -> q.queryParam("job_id", "eq." + jobId));
        return rows.length == 0 ? Optional.empty() : Optional.of(rows[0].toJob());
    }

    @Override
    public List<Job> findByStatus(JobStatus status, int limit) {
        return Arrays.stream(get(q -> q
                        .queryParam("status", "eq." + status.code())
                        .queryParam("order", "created_at.asc,job_id.asc")
                        .queryParam("limit", limit)))
                .map(JobRow::toJob)
                .toList();
    }

    @Override
    public JobStatistics statistics() {
        List<JobStatus> statuses = new ArrayList<>();
        int offset = 0;
        while (true) {
            final int from = offset;
            JobRow[] page = get(q -> q
                    .queryParam("select", "status")
                    .queryParam("order", "job_id.asc")
                    .queryParam("limit", PAGE_SIZE)
                    .queryParam("offset", from));
            for (JobRow row : page) statuses.add(JobStatus.from(row.status()));
            if (page.length < PAGE_SIZE) break;
            offset += PAGE_SIZE;
        }
        return JobStatistics.count(statuses);
    }

    private static Map<String, Object> unlockBody(JobStatus next) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", next.code());
        body.put("locked_by", null);
        body.put("locked_at", null);
        body.put("lock_expires_at", null);
        return body;
    }

    private JobRow[] get(Consumer<UriComponentsBuilder> query) {
        URI uri = uri(q -> {
            query.accept(q);
            if (!q.build().getQueryParams().containsKey("select")) q.queryParam("select", "*");
        });
        JobRow[] rows = call(() -> rest.exchange(uri, HttpMethod.GET,
                new HttpEntity<>(readHeaders()), JobRow[].class).getBody());
        return rows == null ? new JobRow[0] : rows;
    }

    private JobRow[] patch(Consumer<UriComponentsBuilder> filter, Map<String, Object> body) {
        URI uri = uri(filter);
        JobRow[] rows = call(() -> rest.exchange(uri, HttpMethod.PATCH,
                new HttpEntity<>(body, writeHeaders()), JobRow[].class).getBody());
        return rows == null ? new JobRow[0] : rows;
    }

    private URI uri(Consumer<UriComponentsBuilder> query) {
        UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(baseUrl).pathSegment(table);
        query.accept(b);
        return b.build().encode().toUri();
    }

    private static HttpHeaders readHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        return h;
    }

    private static HttpHeaders writeHeaders() {
        HttpHeaders h = readHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.set("Prefer", "return=representation");
        return h;
    }

    private static <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw new JobStoreException(e.getStatusCode().value(),
                    "Job store request failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new JobStoreException("Job store unreachable: " + e.getMessage(), e);
        }
    }
}
