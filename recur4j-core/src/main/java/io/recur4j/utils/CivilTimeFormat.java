package io.recur4j.utils;

import io.recur4j.core.InvalidScheduleException;
import io.recur4j.core.Weekday;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Text encodings for time values crossing the store/executor boundary.
 * <p>
 * <ul>
 *   <li>instants: {@code YYYY-MM-DD HH:MM:SS}, civil time in the job's zone</li>
 *   <li>weekday sets: {@code Mon,Wed,Fri}</li>
 *   <li>time slots: {@code 09:00,15:00} ({@code HH:MM:SS} when seconds are set)</li>
 * </ul>
 */
public final class CivilTimeFormat {

    public static final DateTimeFormatter CIVIL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter SLOT_MINUTES = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter SLOT_SECONDS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private CivilTimeFormat() {
    }

    public static String formatInstant(Instant instant, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        if (instant == null) {
            return null;
        }
        return CIVIL_DATE_TIME.format(instant.atZone(zone));
    }

    public static String formatCivil(LocalDateTime civil) {
        return civil == null ? null : CIVIL_DATE_TIME.format(civil);
    }

    /**
     * Parses {@code YYYY-MM-DD HH:MM[:SS]} (a {@code T} separator is also accepted). Sub-second digits
     * are dropped.
     */
    public static LocalDateTime parseCivil(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidScheduleException("date-time must not be blank");
        }
        String s = text.trim().replace(' ', 'T');
        try {
            return LocalDateTime.parse(s).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ex) {
            throw new InvalidScheduleException("Invalid date-time. Expected YYYY-MM-DD HH:MM:SS: " + text, ex);
        }
    }

    /**
     * Parses a slot in {@code HH:MM} or {@code HH:MM:SS} form, truncating any fraction.
     */
    public static LocalTime parseSlot(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidScheduleException("time of day must not be blank");
        }
        String s = text.trim();
        int dot = s.indexOf('.');
        if (dot >= 0) {
            s = s.substring(0, dot);
        }
        try {
            return LocalTime.parse(s).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ex) {
            throw new InvalidScheduleException("Invalid time of day. Expected HH:MM or HH:MM:SS: " + text, ex);
        }
    }

    public static String formatSlot(LocalTime slot) {
        return slot.getSecond() == 0 ? SLOT_MINUTES.format(slot) : SLOT_SECONDS.format(slot);
    }

    public static String formatSlots(Collection<LocalTime> slots) {
        if (slots == null || slots.isEmpty()) {
            return "";
        }
        return slots.stream().map(CivilTimeFormat::formatSlot).collect(Collectors.joining(","));
    }

    public static String formatDays(Collection<Weekday> days) {
        if (days == null || days.isEmpty()) {
            return "";
        }
        return days.stream().sorted().map(Weekday::token).collect(Collectors.joining(","));
    }
}
