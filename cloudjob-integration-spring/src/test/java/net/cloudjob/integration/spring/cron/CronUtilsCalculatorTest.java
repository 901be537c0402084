package net.cloudjob.integration.spring.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class CronUtilsCalculatorTest {

    final CronUtilsCalculator cron = new CronUtilsCalculator();

    @Test
    void previous_isMostRecentSlot() {
        Instant at = Instant.parse("2024-05-01T00:07:30Z");

        assertEquals(Instant.parse("2024-05-01T00:05:00Z"), cron.previous(at, "*/5 * * * *", ZoneOffset.UTC).orElseThrow());
        assertEquals(Instant.parse("2024-05-01T00:10:00Z"), cron.next(at, "*/5 * * * *", ZoneOffset.UTC).orElseThrow());
    }

    @Test
    void previous_isInclusiveOfMatchingMinute() {
        Instant at = Instant.parse("2024-05-01T00:10:42Z");

        assertEquals(Instant.parse("2024-05-01T00:10:00Z"), cron.previous(at, "*/5 * * * *", ZoneOffset.UTC).orElseThrow());
    }

    @Test
    void zone_shiftsDailySlot() {
        // 매일 09:00 서울 = 00:00 UTC
        Instant at = Instant.parse("2024-05-01T03:00:00Z");

        assertEquals(Instant.parse("2024-05-01T00:00:00Z"),
                cron.previous(at, "0 9 * * *", ZoneId.of("Asia/Seoul")).orElseThrow());
        assertEquals(Instant.parse("2024-05-02T00:00:00Z"),
                cron.next(at, "0 9 * * *", ZoneId.of("Asia/Seoul")).orElseThrow());
    }

    @Test
    void validate_rejectsMalformed() {
        assertDoesNotThrow(() -> cron.validate("0 */6 * * *"));
        assertThatThrownBy(() -> cron.validate("not a cron")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cron.validate("61 * * * *")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cron.validate(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
