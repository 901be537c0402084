package net.cloudjob.core.support;

import net.cloudjob.core.spi.CronCalculator;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * "every:&lt;초&gt;" 형식만 이해하는 테스트용 계산기. 슬롯은 epoch 기준 배수.
 * 그 외 식은 잘못된 식으로 취급한다.
 */
public final class FixedCron implements CronCalculator {

    private static long period(String expr) {
        if (expr == null || !expr.startsWith("every:")) {
            throw new IllegalArgumentException("unsupported expression: " + expr);
        }
        long s = Long.parseLong(expr.substring("every:".length()));
        if (s <= 0) throw new IllegalArgumentException("period must be positive: " + expr);
        return s;
    }

    @Override
    public Optional<Instant> previous(Instant at, String cronExpr, ZoneId zone) {
        long p = period(cronExpr);
        long sec = at.getEpochSecond();
        return Optional.of(Instant.ofEpochSecond(sec - Math.floorMod(sec, p)));
    }

    @Override
    public Optional<Instant> next(Instant from, String cronExpr, ZoneId zone) {
        long p = period(cronExpr);
        return previous(from, cronExpr, zone).map(prev -> prev.plus(Duration.ofSeconds(p)));
    }

    @Override
    public void validate(String cronExpr) {
        period(cronExpr);
    }
}
