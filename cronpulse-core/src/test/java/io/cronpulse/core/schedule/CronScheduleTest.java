package io.cronpulse.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class CronScheduleTest {

    @Test
    void shouldFireFiveFieldExpressionsAtSecondZero() {
        CronSchedule schedule = CronSchedule.parse("*/15 * * * *", ZoneOffset.UTC);

        Instant next = schedule.next(Instant.parse("2026-03-01T10:07:30Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-03-01T10:15:00Z"));
    }

    @Test
    void shouldReturnStrictlyLaterFireTime() {
        CronSchedule schedule = CronSchedule.parse("* * * * *", ZoneOffset.UTC);

        Instant next = schedule.next(Instant.parse("2026-03-01T10:15:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-03-01T10:16:00Z"));
    }

    @Test
    void shouldAcceptSixFieldExpressionsWithSeconds() {
        CronSchedule schedule = CronSchedule.parse("*/10 * * * * *", ZoneOffset.UTC);

        Instant next = schedule.next(Instant.parse("2026-03-01T10:15:01Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-03-01T10:15:10Z"));
    }

    @Test
    void shouldEvaluateInConfiguredZone() {
        CronSchedule schedule = CronSchedule.parse("0 9 * * *", ZoneId.of("Europe/Berlin"));

        Instant next = schedule.next(Instant.parse("2026-01-15T00:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-01-15T08:00:00Z"));
    }

    @Test
    void shouldRejectMalformedExpressions() {
        assertThatThrownBy(() -> CronSchedule.parse("not a cron", ZoneOffset.UTC))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("not a cron");
        assertThatThrownBy(() -> CronSchedule.parse("61 * * * *", ZoneOffset.UTC))
            .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> CronSchedule.parse("", ZoneOffset.UTC))
            .isInstanceOf(InvalidScheduleException.class);
        assertThat(CronSchedule.isValid("0 0 1 1 *")).isTrue();
        assertThat(CronSchedule.isValid("* * *")).isFalse();
    }
}
