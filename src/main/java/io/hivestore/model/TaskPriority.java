package io.hivestore.model;

/**
 * Dispatch priority of a task. Lower rank is dispatched first.
 */
public enum TaskPriority implements WireValue {
    CRITICAL("critical", 1),
    HIGH("high", 2),
    MEDIUM("medium", 3),
    LOW("low", 4);

    private final String wireValue;
    private final int rank;

    TaskPriority(String wireValue, int rank) {
        this.wireValue = wireValue;
        this.rank = rank;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public int rank() {
        return rank;
    }

    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (TaskPriority value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + raw);
    }
}
