package net.cloudjob.core.service;

import java.time.Duration;

/** 실패한 시도 이후 다음 시도까지의 지연 */
public interface RetryPolicy {
    Duration nextBackoff(long attempt);

    /** 지연 없이 즉시 재시도 가능 */
    static RetryPolicy immediate() {
        return attempt -> Duration.ZERO;
    }

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** base * 2^(attempt-1), max 로 상한 */
    static RetryPolicy exponential(Duration base, Duration max) {
        if (base.isZero() || base.isNegative()) return immediate();
        return attempt -> {
            long shift = Math.min(Math.max(attempt - 1, 0), 30);
            Duration d = base.multipliedBy(1L << shift);
            return (max != null && d.compareTo(max) > 0) ? max : d;
        };
    }
}
