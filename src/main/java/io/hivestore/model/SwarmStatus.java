package io.hivestore.model;

public enum SwarmStatus implements WireValue {
    ACTIVE("active"),
    PAUSED("paused"),
    ARCHIVED("archived");

    private final String wireValue;

    SwarmStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static SwarmStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing swarm status");
        }
        for (SwarmStatus value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown swarm status: " + raw);
    }
}
