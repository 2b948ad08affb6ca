package io.hivestore.model;

public enum AgentStatus implements WireValue {
    IDLE("idle"),
    BUSY("busy"),
    ACTIVE("active"),
    ERROR("error"),
    OFFLINE("offline");

    private final String wireValue;

    AgentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static AgentStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing agent status");
        }
        for (AgentStatus value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + raw);
    }
}
