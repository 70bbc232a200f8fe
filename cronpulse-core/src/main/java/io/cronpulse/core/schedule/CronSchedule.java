package io.cronpulse.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import org.springframework.scheduling.support.CronExpression;

// Five-field expressions fire at second zero; six fields carry their own seconds.
public final class CronSchedule {
    private final String expression;
    private final CronExpression cron;
    private final ZoneId zone;

    private CronSchedule(String expression, CronExpression cron, ZoneId zone) {
        this.expression = expression;
        this.cron = cron;
        this.zone = zone;
    }

    public static CronSchedule parse(String expression, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "expression is required");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String normalized = switch (fields.length) {
            case 5 -> "0 " + String.join(" ", fields);
            case 6 -> String.join(" ", fields);
            default -> throw new InvalidScheduleException(trimmed, "expected 5 or 6 fields but found " + fields.length);
        };
        try {
            return new CronSchedule(trimmed, CronExpression.parse(normalized), zone);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(trimmed, e.getMessage(), e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression, ZoneId.of("UTC"));
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    public Optional<Instant> next(Instant after) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return expression + " (" + zone + ")";
    }
}
