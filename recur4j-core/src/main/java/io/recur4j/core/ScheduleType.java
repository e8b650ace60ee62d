package io.recur4j.core;

import java.util.Locale;

public enum ScheduleType {
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    DAILY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    WEEKLY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    /**
     * Only recurring rules take part in bulk recalculation.
     */
    public abstract boolean isRecurring();

    public static ScheduleType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidScheduleException("schedule_type is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidScheduleException("Unknown schedule_type: " + raw);
        }
    }
}
