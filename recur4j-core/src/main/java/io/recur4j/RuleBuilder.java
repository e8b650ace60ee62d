package io.recur4j;

import io.recur4j.core.ScheduleRule;
import io.recur4j.core.ScheduleType;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Fluent builder turning raw operator input into a {@link ScheduleRule}.
 *
 * <p>Note:
 * <ul>
 *   <li>weekday tokens are parsed leniently: unknown tokens are dropped</li>
 *   <li>build(): normalizes, then validates the result (a WEEKLY rule left with no day is rejected)</li>
 *   <li>buildUnchecked(): normalizes only, for rows read back from storage</li>
 * </ul>
 */
public interface RuleBuilder {

    RuleBuilder type(ScheduleType type);

    /**
     * Schedule type tag ({@code ONCE}, {@code DAILY}, {@code WEEKLY}); unknown tags are rejected.
     */
    RuleBuilder type(String type);

    RuleBuilder runAt(LocalDateTime runAt);

    /**
     * One-time instant as {@code YYYY-MM-DD HH:MM[:SS]}. Blank clears it.
     */
    RuleBuilder runAt(String runAt);

    /**
     * Legacy single slot. Only used when {@link #timesOfDay(String)} yields nothing.
     */
    RuleBuilder timeOfDay(String timeOfDay);

    /**
     * Comma-separated slots, e.g. {@code "09:00,15:00"}.
     */
    RuleBuilder timesOfDay(String csv);

    RuleBuilder timesOfDay(Collection<String> slots);

    /**
     * Comma-separated weekday tokens, e.g. {@code "Mon,Wed,Fri"}.
     */
    RuleBuilder daysOfWeek(String csv);

    RuleBuilder daysOfWeek(Collection<String> tokens);

    /**
     * IANA zone id. Null or blank falls back to the builder's default zone.
     */
    RuleBuilder timezone(String timezone);

    ScheduleRule build();

    ScheduleRule buildUnchecked();
}
