package io.recur4j.core;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Defaults handed explicitly to the components that need them.
 *
 * @param defaultZone        zone used when operator input names none
 * @param onceFallbackDelay  how far ahead a lapsed ONCE job is re-armed on save
 */
public record ScheduleDefaults(
        ZoneId defaultZone,
        Duration onceFallbackDelay
) {

    public ScheduleDefaults {
        Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        Objects.requireNonNull(onceFallbackDelay, "onceFallbackDelay must not be null");
        if (onceFallbackDelay.isNegative() || onceFallbackDelay.isZero()) {
            throw new IllegalArgumentException("onceFallbackDelay must be a positive duration");
        }
    }

    public static ScheduleDefaults of(String zoneId) {
        return new ScheduleDefaults(ZoneId.of(zoneId), Duration.ofMinutes(1));
    }
}
