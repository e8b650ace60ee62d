package io.recur4j.core;

public record PersistResult(
        String id,
        boolean created,
        boolean updated
) {
    public static PersistResult createdResult(String id) {
        return new PersistResult(id, true, false);
    }

    public static PersistResult updatedResult(String id) {
        return new PersistResult(id, false, true);
    }

    public static PersistResult noop(String id) {
        return new PersistResult(id, false, false);
    }
}
