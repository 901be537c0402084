package net.cloudjob.core.service;

import net.cloudjob.core.model.CronJobDefinition;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.spi.Clock;
import net.cloudjob.core.spi.CronCalculator;
import net.cloudjob.core.spi.JobStore;
import net.cloudjob.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 크론 정의 → WAITING 잡 생성.
 * 정의별 마지막 발화 슬롯은 메모리에만 둔다. 재시작하면 잃어버리고 첫 평가 규칙(grace)으로 다시 시작.
 */
public final class JobCreator {
    private static final Logger log = LoggerFactory.getLogger(JobCreator.class);

    public static final Duration DEFAULT_FIRST_RUN_GRACE = Duration.ofMinutes(5);
    private static final DateTimeFormatter NAME_SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final JobStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final CronCalculator cron;
    private final ZoneId zone;
    private final Duration firstRunGrace;
    private final List<CronJobDefinition> definitions;

    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public JobCreator(JobStore store, TxRunner tx, Clock clock, CronCalculator cron, ZoneId zone,
                      Collection<CronJobDefinition> definitions, Duration firstRunGrace) {
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.zone = zone;
        this.firstRunGrace = firstRunGrace;
        this.definitions = List.copyOf(acceptValid(definitions));
        log.info("Job creator loaded {} cron definition(s)", this.definitions.size());
    }

    private List<CronJobDefinition> acceptValid(Collection<CronJobDefinition> defs) {
        List<CronJobDefinition> ok = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (CronJobDefinition d : defs) {
            if (d.name() == null || d.name().isBlank()) {
                log.warn("Skipping cron definition without name: {}", d);
                continue;
            }
            if (d.jobType() == null || d.jobType() == JobType.UNKNOWN) {
                log.warn("Skipping cron definition '{}': unknown job type", d.name());
                continue;
            }
            if (d.maxRetries() < 0) {
                log.warn("Skipping cron definition '{}': negative max retries {}", d.name(), d.maxRetries());
                continue;
            }
            try {
                cron.validate(d.cronExpression());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping cron definition '{}': invalid cron '{}': {}",
                        d.name(), d.cronExpression(), e.getMessage());
                continue;
            }
            if (!names.add(d.name())) {
                log.warn("Skipping duplicate cron definition '{}'", d.name());
                continue;
            }
            ok.add(d);
        }
        return ok;
    }

    /**
     * 한 번의 평가. 활성 정의마다 now 이전(포함) 최근 슬롯을 구해서
     * <ul>
     *   <li>첫 평가: 슬롯이 grace 안에 있으면 생성</li>
     *   <li>이후: 마지막 발화 슬롯보다 새 슬롯이면 생성</li>
     * </ul>
     * 한 정의의 실패가 다른 정의에 영향을 주지 않는다.
     */
    public int createDueJobs() {
        Instant now = clock.now();
        int count = 0;
        for (CronJobDefinition def : definitions) {
            if (!def.enabled()) continue;
            try {
                Optional<Instant> prev = cron.previous(now, def.cronExpression(), zone);
                if (prev.isEmpty()) continue;
                Instant slot = prev.get();

                Instant last = lastFired.get(def.name());
                boolean due = last == null
                        ? !slot.isBefore(now.minus(firstRunGrace))
                        : slot.isAfter(last);
                if (!due) {
                    if (last == null) lastFired.put(def.name(), slot);
                    continue;
                }

                Job job = materialize(def, now);
                tx.required(() -> store.insert(job));
                lastFired.put(def.name(), slot);
                created.incrementAndGet();
                count++;
                log.info("Created job {} ({}) from cron '{}' slot {}", job.jobId(), job.name(), def.cronExpression(), slot);
            } catch (Exception e) {
                errors.incrementAndGet();
                log.error("Failed to create job for cron definition '{}'", def.name(), e);
            }
        }
        return count;
    }

    /** 크론과 무관한 단건 등록 */
    public Job submit(String name, JobType type, Map<String, Object> config, int maxRetries, String description)
            throws Exception {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (type == null || type == JobType.UNKNOWN) throw new IllegalArgumentException("unknown job type");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);

        Job job = Job.ofNew(name, description == null ? "" : description, type, config, maxRetries, clock.now());
        Job saved = tx.required(() -> store.insert(job));
        log.info("Submitted job {} ({}, type={})", saved.jobId(), saved.name(), type.code());
        return saved;
    }

    private Job materialize(CronJobDefinition def, Instant now) {
        String name = def.name() + "_" + NAME_SUFFIX.format(now);
        String description = (def.description().isEmpty() ? def.name() : def.description())
                + " (Auto-created by cron: " + def.cronExpression() + ")";
        return Job.ofNew(name, description, def.jobType(), def.config(), def.maxRetries(), now);
    }

    public List<CronJobDefinition> definitions() {
        return definitions;
    }

    public long created() {
        return created.get();
    }

    public long errors() {
        return errors.get();
    }
}
