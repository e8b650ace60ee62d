package io.recur4j.core;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Optional;

/**
 * Weekday vocabulary used by WEEKLY rules. Monday-first, Mon=1 ... Sun=7.
 */
public enum Weekday {

    MON("Mon", "MONDAY"),
    TUE("Tue", "TUESDAY"),
    WED("Wed", "WEDNESDAY"),
    THU("Thu", "THURSDAY"),
    FRI("Fri", "FRIDAY"),
    SAT("Sat", "SATURDAY"),
    SUN("Sun", "SUNDAY");

    private final String token;
    private final String fullName;

    Weekday(String token, String fullName) {
        this.token = token;
        this.fullName = fullName;
    }

    /**
     * Canonical wire token, e.g. {@code Mon}.
     */
    public String token() {
        return token;
    }

    public int isoNumber() {
        return ordinal() + 1;
    }

    public DayOfWeek toDayOfWeek() {
        return DayOfWeek.of(isoNumber());
    }

    public static Weekday of(DayOfWeek dayOfWeek) {
        return values()[dayOfWeek.getValue() - 1];
    }

    /**
     * Accepts "mon", "Mon", "MONDAY" and so on. Unknown tokens yield empty.
     */
    public static Optional<Weekday> parseLenient(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.isEmpty()) {
            return Optional.empty();
        }
        for (Weekday d : values()) {
            if (d.name().equals(s) || d.fullName.equals(s)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    public static Weekday parse(String raw) {
        return parseLenient(raw)
                .orElseThrow(() -> new InvalidScheduleException("Unknown weekday: " + raw));
    }
}
