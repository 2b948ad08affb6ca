package io.hivestore.model;

public enum AgentType implements WireValue {
    COORDINATOR("coordinator"),
    RESEARCHER("researcher"),
    CODER("coder"),
    ANALYST("analyst"),
    ARCHITECT("architect"),
    TESTER("tester"),
    REVIEWER("reviewer"),
    OPTIMIZER("optimizer"),
    DOCUMENTER("documenter"),
    MONITOR("monitor"),
    SPECIALIST("specialist");

    private final String wireValue;

    AgentType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static AgentType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing agent type");
        }
        for (AgentType value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + raw);
    }
}
