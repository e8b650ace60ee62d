package io.recur4j.core;

import java.util.Locale;

/**
 * Dispatch channel of a job. The executor owns the actual transport.
 */
public enum Channel {
    HTTP,
    MQTT;

    public static Channel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidScheduleException("channel is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidScheduleException("Unsupported channel: " + raw);
        }
    }
}
