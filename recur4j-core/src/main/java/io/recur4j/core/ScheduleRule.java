package io.recur4j.core;

import io.recur4j.utils.CivilTimeFormat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Timing configuration of a job.
 *
 * <p>The canonical constructor normalizes slots (whole seconds, de-duplicated, ascending) and copies
 * the weekday set, but does not check well-formedness; see {@link #validate()}.
 *
 * @param type       ONCE, DAILY or WEEKLY
 * @param runAt      civil date-time of a ONCE rule, interpreted in {@code timezone}
 * @param timesOfDay civil slots used by DAILY/WEEKLY
 * @param daysOfWeek target weekdays of a WEEKLY rule
 * @param timezone   zone whose civil calendar all arithmetic uses
 */
public record ScheduleRule(
        ScheduleType type,
        LocalDateTime runAt,
        List<LocalTime> timesOfDay,
        Set<Weekday> daysOfWeek,
        ZoneId timezone
) {

    public ScheduleRule {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(timezone, "timezone must not be null");
        runAt = runAt == null ? null : runAt.truncatedTo(ChronoUnit.SECONDS);
        timesOfDay = normalizeSlots(timesOfDay);
        daysOfWeek = (daysOfWeek == null || daysOfWeek.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
    }

    public static ScheduleRule once(LocalDateTime runAt, ZoneId timezone) {
        return new ScheduleRule(ScheduleType.ONCE, runAt, List.of(), Set.of(), timezone);
    }

    public static ScheduleRule daily(Collection<LocalTime> slots, ZoneId timezone) {
        return new ScheduleRule(ScheduleType.DAILY, null, List.copyOf(slots), Set.of(), timezone);
    }

    public static ScheduleRule weekly(Collection<Weekday> days, Collection<LocalTime> slots, ZoneId timezone) {
        return new ScheduleRule(ScheduleType.WEEKLY, null, List.copyOf(slots), Set.copyOf(days), timezone);
    }

    /**
     * Checks that a ONCE rule has {@code runAt} and that a recurring rule has slots (and days, for WEEKLY).
     *
     * @return this rule, for chaining
     * @throws InvalidScheduleException describing the first violation found
     */
    public ScheduleRule validate() {
        switch (type) {
            case ONCE -> {
                if (runAt == null) {
                    throw new InvalidScheduleException("ONCE requires run_at");
                }
            }
            case DAILY -> {
                if (timesOfDay.isEmpty()) {
                    throw new InvalidScheduleException("DAILY requires at least one time of day");
                }
            }
            case WEEKLY -> {
                if (daysOfWeek.isEmpty()) {
                    throw new InvalidScheduleException("WEEKLY requires at least one day (Mon..Sun)");
                }
                if (timesOfDay.isEmpty()) {
                    throw new InvalidScheduleException("WEEKLY requires at least one time of day");
                }
            }
        }
        return this;
    }

    public boolean isWellFormed() {
        try {
            validate();
            return true;
        } catch (InvalidScheduleException ex) {
            return false;
        }
    }

    /**
     * Canonical wire encoding, e.g. {@code WEEKLY|Asia/Taipei||09:00,15:00|Mon,Wed}.
     */
    public String canonical() {
        return String.join("|",
                type.name(),
                timezone.getId(),
                runAt == null ? "" : CivilTimeFormat.formatCivil(runAt),
                CivilTimeFormat.formatSlots(timesOfDay),
                CivilTimeFormat.formatDays(daysOfWeek));
    }

    /**
     * SHA-256 of {@link #canonical()}, recorded next to a cached next-run value so a stale cache is
     * detectable after the rule changes.
     */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static List<LocalTime> normalizeSlots(List<LocalTime> slots) {
        if (slots == null || slots.isEmpty()) {
            return List.of();
        }
        TreeSet<LocalTime> sorted = new TreeSet<>();
        for (LocalTime t : slots) {
            if (t != null) {
                sorted.add(t.truncatedTo(ChronoUnit.SECONDS));
            }
        }
        return List.copyOf(sorted);
    }
}
