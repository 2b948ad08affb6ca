package io.hivestore.model;

public enum TaskStatus implements WireValue {
    PENDING("pending", false),
    ASSIGNED("assigned", false),
    IN_PROGRESS("in_progress", false),
    COMPLETED("completed", true),
    FAILED("failed", true),
    CANCELLED("cancelled", true);

    private final String wireValue;
    private final boolean terminal;

    TaskStatus(String wireValue, boolean terminal) {
        this.wireValue = wireValue;
        this.terminal = terminal;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static TaskStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing task status");
        }
        for (TaskStatus value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
