package net.cloudjob.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** cron-utils 기반 슬롯 계산기 (5필드 UNIX cron, LRU 캐시) */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, ExecutionTime> CACHE = Collections.synchronizedMap(new LruMap<>(256));

    private CronSlotPlanner() {}

    /**
     * now 기준 슬롯.
     * slotStart 는 now 이전(포함)의 가장 최근 발화 시각, next 는 now 이후 첫 발화 시각.
     */
    public static SlotInfo compute(String cronExpr, ZoneId zone, Instant now) {
        Objects.requireNonNull(zone);
        Objects.requireNonNull(now);
        ExecutionTime et = executionTime(cronExpr);

        ZonedDateTime base = now.atZone(zone);
        ZonedDateTime minute = base.truncatedTo(ChronoUnit.MINUTES);
        Optional<ZonedDateTime> prev = et.isMatch(minute) ? Optional.of(minute) : et.lastExecution(base);
        Optional<ZonedDateTime> next = et.nextExecution(base);

        return new SlotInfo(prev.map(ZonedDateTime::toInstant).orElse(null),
                next.map(ZonedDateTime::toInstant).orElse(null));
    }

    /** 파싱 실패는 IllegalArgumentException */
    public static ExecutionTime executionTime(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String expr = cronExpr.trim();
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(expr);
            if (cached != null) return cached;
        }
        ExecutionTime et;
        try {
            et = ExecutionTime.forCron(PARSER.parse(expr));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid cron expression [" + expr + "]: " + e.getMessage(), e);
        }
        CACHE.put(expr, et);
        return et;
    }

    public static void invalidateAll() { CACHE.clear(); }

    /** 슬롯이 없으면(예: 존재하지 않는 날짜) 해당 필드는 null */
    public record SlotInfo(Instant slotStartUtc, Instant nextUtc) {
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
