package io.recur4j.internal;

import io.recur4j.RuleBuilder;
import io.recur4j.core.InvalidScheduleException;
import io.recur4j.core.ScheduleRule;
import io.recur4j.core.ScheduleType;
import io.recur4j.core.Weekday;
import io.recur4j.utils.CivilTimeFormat;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Default {@link RuleBuilder}. Created with the zone used when the input names none.
 */
public class SimpleRuleBuilder implements RuleBuilder {

    private final ZoneId defaultZone;

    private ScheduleType type;
    private LocalDateTime runAt;
    private LocalTime legacySlot;
    private final List<LocalTime> slots = new ArrayList<>();
    private final Set<Weekday> days = EnumSet.noneOf(Weekday.class);
    private ZoneId timezone;

    public SimpleRuleBuilder(ZoneId defaultZone) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    @Override
    public RuleBuilder type(ScheduleType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        return this;
    }

    @Override
    public RuleBuilder type(String type) {
        this.type = ScheduleType.parse(type);
        return this;
    }

    @Override
    public RuleBuilder runAt(LocalDateTime runAt) {
        this.runAt = runAt;
        return this;
    }

    @Override
    public RuleBuilder runAt(String runAt) {
        this.runAt = isBlank(runAt) ? null : CivilTimeFormat.parseCivil(runAt);
        return this;
    }

    @Override
    public RuleBuilder timeOfDay(String timeOfDay) {
        this.legacySlot = isBlank(timeOfDay) ? null : CivilTimeFormat.parseSlot(timeOfDay);
        return this;
    }

    @Override
    public RuleBuilder timesOfDay(String csv) {
        slots.clear();
        if (isBlank(csv)) {
            return this;
        }
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                slots.add(CivilTimeFormat.parseSlot(part));
            }
        }
        return this;
    }

    @Override
    public RuleBuilder timesOfDay(Collection<String> values) {
        slots.clear();
        if (values == null) {
            return this;
        }
        for (String v : values) {
            if (!isBlank(v)) {
                slots.add(CivilTimeFormat.parseSlot(v));
            }
        }
        return this;
    }

    @Override
    public RuleBuilder daysOfWeek(String csv) {
        days.clear();
        if (isBlank(csv)) {
            return this;
        }
        String cleaned = csv.replace("(", "").replace(")", "").replace(" ", "");
        for (String token : cleaned.split(",")) {
            Weekday.parseLenient(token).ifPresent(days::add);
        }
        return this;
    }

    @Override
    public RuleBuilder daysOfWeek(Collection<String> tokens) {
        days.clear();
        if (tokens == null) {
            return this;
        }
        for (String token : tokens) {
            Weekday.parseLenient(token).ifPresent(days::add);
        }
        return this;
    }

    @Override
    public RuleBuilder timezone(String timezone) {
        if (isBlank(timezone)) {
            this.timezone = null;
            return this;
        }
        try {
            this.timezone = ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, ex);
        }
        return this;
    }

    @Override
    public ScheduleRule build() {
        return buildUnchecked().validate();
    }

    @Override
    public ScheduleRule buildUnchecked() {
        if (type == null) {
            throw new InvalidScheduleException("schedule_type is required");
        }
        List<LocalTime> effective = new ArrayList<>(slots);
        if (effective.isEmpty() && legacySlot != null) {
            effective.add(legacySlot);
        }
        return new ScheduleRule(
                type,
                type == ScheduleType.ONCE ? runAt : null,
                type == ScheduleType.ONCE ? List.of() : effective,
                type == ScheduleType.WEEKLY ? days : Set.of(),
                timezone != null ? timezone : defaultZone
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
