package io.hivestore.model;

public enum ConsensusStatus implements WireValue {
    PENDING("pending", false),
    ACHIEVED("achieved", true),
    FAILED("failed", true),
    TIMEOUT("timeout", true);

    private final String wireValue;
    private final boolean terminal;

    ConsensusStatus(String wireValue, boolean terminal) {
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

    public static ConsensusStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing consensus status");
        }
        for (ConsensusStatus value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown consensus status: " + raw);
    }
}
