package net.cloudjob.core.scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/** 스케줄러 프로세스 하나의 식별자와 주기 설정. 모든 루프에 명시적으로 전달한다 */
public record SchedulerInstance(
        String instanceId,
        Duration lease,
        Duration executorInterval,
        Duration creatorInterval,
        Duration reaperInterval,
        Duration shutdownTimeout
) {
    public static final String DEFAULT_PREFIX = "cloudjob";
    public static final Duration DEFAULT_LEASE = Duration.ofMinutes(30);
    public static final Duration DEFAULT_EXECUTOR_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CREATOR_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_REAPER_INTERVAL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public SchedulerInstance {
        Objects.requireNonNull(instanceId, "instanceId");
        requirePositive(lease, "lease");
        requirePositive(executorInterval, "executorInterval");
        requirePositive(creatorInterval, "creatorInterval");
        requirePositive(reaperInterval, "reaperInterval");
        requirePositive(shutdownTimeout, "shutdownTimeout");
    }

    public static SchedulerInstance withDefaults(String prefix) {
        return new SchedulerInstance(newInstanceId(prefix), DEFAULT_LEASE, DEFAULT_EXECUTOR_INTERVAL,
                DEFAULT_CREATOR_INTERVAL, DEFAULT_REAPER_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /** prefix-xxxxxxxx (uuid 앞 8자) */
    public static String newInstanceId(String prefix) {
        String p = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
        return p + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }
}
