package io.recur4j.utils;

import io.recur4j.core.ScheduleRule;
import io.recur4j.core.Weekday;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the next fire time of a {@link ScheduleRule}.
 * <p>
 * Supported rule types:
 * <ul>
 *   <li>ONCE: {@code runAt} if it is still ahead of now</li>
 *   <li>DAILY: first slot after now, scanning today and the next two days</li>
 *   <li>WEEKLY: first slot after now on a selected weekday, scanning today and the next 14 days</li>
 * </ul>
 * <p>
 * All arithmetic happens on the civil calendar of the rule's zone, so "09:00" stays 09:00 local time
 * across DST changes. A slot that falls into a DST gap is pushed forward by the gap length; an ambiguous
 * slot resolves to the earlier offset.
 * <p>
 * The result is always strictly after {@code now}. A rule that cannot fire again yields empty; malformed
 * rules are not reported here, callers validate them first.
 */
public final class RecurrenceEvaluator {

    static final int DAILY_WINDOW_DAYS = 3;
    static final int WEEKLY_WINDOW_DAYS = 15;

    private RecurrenceEvaluator() {
    }

    public static Optional<ZonedDateTime> computeNextRun(ScheduleRule rule, Instant now) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(now, "now must not be null");
        return computeNextRun(rule, now.atZone(rule.timezone()));
    }

    /**
     * @param rule rule to evaluate
     * @param now  current time; converted into the rule's zone before any arithmetic
     * @return next fire time in the rule's zone, or empty when the rule has no future occurrence
     */
    public static Optional<ZonedDateTime> computeNextRun(ScheduleRule rule, ZonedDateTime now) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(now, "now must not be null");

        ZoneId zone = rule.timezone();
        ZonedDateTime localNow = now.withZoneSameInstant(zone);

        return switch (rule.type()) {
            case ONCE -> nextOnce(rule.runAt(), zone, localNow);
            case DAILY -> scan(rule.timesOfDay(), null, zone, localNow, DAILY_WINDOW_DAYS);
            case WEEKLY -> rule.daysOfWeek().isEmpty()
                    ? Optional.empty()
                    : scan(rule.timesOfDay(), rule.daysOfWeek(), zone, localNow, WEEKLY_WINDOW_DAYS);
        };
    }

    /**
     * Convenience for storage layers: the next fire time as an {@link Instant}, or {@code null}.
     */
    public static Instant nextRunInstant(ScheduleRule rule, Instant now) {
        return computeNextRun(rule, now).map(ZonedDateTime::toInstant).orElse(null);
    }

    private static Optional<ZonedDateTime> nextOnce(LocalDateTime runAt, ZoneId zone, ZonedDateTime now) {
        if (runAt == null) {
            return Optional.empty();
        }
        ZonedDateTime candidate = ZonedDateTime.of(runAt, zone);
        return candidate.isAfter(now) ? Optional.of(candidate) : Optional.empty();
    }

    // days == null means every day
    private static Optional<ZonedDateTime> scan(
            List<LocalTime> slots,
            Set<Weekday> days,
            ZoneId zone,
            ZonedDateTime now,
            int windowDays
    ) {
        if (slots.isEmpty()) {
            return Optional.empty();
        }

        LocalDate today = now.toLocalDate();
        for (int offset = 0; offset < windowDays; offset++) {
            LocalDate date = today.plusDays(offset);
            if (days != null && !days.contains(Weekday.of(date.getDayOfWeek()))) {
                continue;
            }
            // Slots are ascending, but a DST gap can push one past its successor, so keep the minimum.
            ZonedDateTime best = null;
            for (LocalTime slot : slots) {
                ZonedDateTime candidate = ZonedDateTime.of(date, slot, zone);
                if (candidate.isAfter(now) && (best == null || candidate.isBefore(best))) {
                    best = candidate;
                }
            }
            if (best != null) {
                return Optional.of(best);
            }
        }
        return Optional.empty();
    }
}
