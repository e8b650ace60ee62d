package io.recur4j.core;

import java.util.Locale;

public enum RunStatus {
    SUCCESS,
    FAILED;

    public static RunStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown run status: " + raw, ex);
        }
    }
}
