package net.cloudjob.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

public interface CronCalculator {
    /** at 이전(포함)의 가장 최근 슬롯 */
    Optional<Instant> previous(Instant at, String cronExpr, ZoneId zone);

    Optional<Instant> next(Instant from, String cronExpr, ZoneId zone);

    /** 잘못된 식이면 IllegalArgumentException */
    void validate(String cronExpr);
}
