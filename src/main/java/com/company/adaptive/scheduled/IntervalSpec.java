package com.company.adaptive.scheduled;

import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.util.TimeUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * When a maintenance job runs: either a fixed period or a Spring cron expression
 * (six fields, seconds first).
 *
 * <p>Fixed periods are anchored to the first scheduled time, so runs land on
 * {@code t0 + p, t0 + 2p, ...} no matter how long or how badly a run went.
 */
public final class IntervalSpec {

    private static final Pattern SHORT_FORM = Pattern.compile("^(\\d+)(ms|s|m|h|d)$");
    private static final Pattern EVERY_FORM = Pattern.compile("^every_(\\d+)_(seconds|minutes|hours|days)$");

    private final Duration period;
    private final CronExpression cron;
    private final String source;

    private IntervalSpec(Duration period, CronExpression cron, String source) {
        this.period = period;
        this.cron = cron;
        this.source = source;
    }

    public static IntervalSpec every(Duration period) {
        if (period == null || period.toMillis() <= 0) {
            throw new InvalidRequestException("Job period must be positive, got " + period);
        }
        return new IntervalSpec(period, null, "every " + TimeUtils.formatDuration(period));
    }

    public static IntervalSpec cron(String expression) {
        try {
            return new IntervalSpec(null, CronExpression.parse(expression), expression);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid cron expression '" + expression + "': " + e.getMessage());
        }
    }

    /**
     * Accepts {@code hourly}, {@code daily}, {@code weekly}, {@code every_30_minutes},
     * short forms such as {@code 60s} / {@code 5m} / {@code 1h}, ISO-8601 durations
     * ({@code PT5M}) and cron expressions.
     */
    public static IntervalSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidRequestException("Interval spec must not be blank");
        }
        try {
            return parseText(spec.trim());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidRequestException("Interval spec out of range: " + spec);
        }
    }

    private static IntervalSpec parseText(String text) {
        String lower = text.toLowerCase(Locale.ROOT);

        switch (lower) {
            case "hourly":
                return every(Duration.ofHours(1));
            case "daily":
                return every(Duration.ofDays(1));
            case "weekly":
                return every(Duration.ofDays(7));
            default:
                break;
        }

        Matcher shortForm = SHORT_FORM.matcher(lower);
        if (shortForm.matches()) {
            long amount = Long.parseLong(shortForm.group(1));
            return every(switch (shortForm.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            });
        }

        Matcher everyForm = EVERY_FORM.matcher(lower);
        if (everyForm.matches()) {
            long amount = Long.parseLong(everyForm.group(1));
            return every(switch (everyForm.group(2)) {
                case "seconds" -> Duration.ofSeconds(amount);
                case "minutes" -> Duration.ofMinutes(amount);
                case "hours" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            });
        }

        if (lower.startsWith("p")) {
            Duration iso = parseIsoDuration(text);
            if (iso != null) {
                return every(iso);
            }
        }

        if (CronExpression.isValidExpression(text)) {
            return cron(text);
        }
        throw new InvalidRequestException("Unrecognized interval spec: " + text);
    }

    public boolean isCron() {
        return cron != null;
    }

    public Duration getPeriod() {
        return period;
    }

    /**
     * First run time for a job scheduled at {@code now}, or null if a cron
     * expression never fires.
     */
    public Instant firstRunAt(Instant now, ZoneId zone) {
        if (period != null) {
            return now.plus(period);
        }
        return nextCronTime(now, zone);
    }

    /**
     * Next run time after a run that was due at {@code scheduledAt} and finished at
     * {@code now}. Fixed periods keep their anchor and skip slots already in the past.
     */
    public Instant nextRunAt(Instant scheduledAt, Instant now, ZoneId zone) {
        if (period == null) {
            return nextCronTime(now, zone);
        }
        Instant next = scheduledAt.plus(period);
        if (!next.isAfter(now)) {
            long periodMillis = period.toMillis();
            long behind = Duration.between(next, now).toMillis();
            long skipped = behind / periodMillis + 1;
            next = next.plus(period.multipliedBy(skipped));
        }
        return next;
    }

    private static Duration parseIsoDuration(String text) {
        try {
            return Duration.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Instant nextCronTime(Instant now, ZoneId zone) {
        ZonedDateTime next = cron.next(now.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalSpec other)) return false;
        return Objects.equals(period, other.period) && Objects.equals(cron, other.cron);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, cron);
    }

    @Override
    public String toString() {
        return source;
    }
}
