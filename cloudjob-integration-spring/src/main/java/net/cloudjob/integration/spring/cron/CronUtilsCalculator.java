package net.cloudjob.integration.spring.cron;

import net.cloudjob.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** 코어 SPI 구현체 */
public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Optional<Instant> previous(Instant at, String cronExpr, ZoneId zone) {
        return Optional.ofNullable(CronSlotPlanner.compute(cronExpr, zone, at).slotStartUtc());
    }

    @Override
    public Optional<Instant> next(Instant from, String cronExpr, ZoneId zone) {
        return Optional.ofNullable(CronSlotPlanner.compute(cronExpr, zone, from).nextUtc());
    }

    @Override
    public void validate(String cronExpr) {
        CronSlotPlanner.executionTime(cronExpr);
    }
}
