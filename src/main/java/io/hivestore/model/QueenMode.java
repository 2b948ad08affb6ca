package io.hivestore.model;

public enum QueenMode implements WireValue {
    CENTRALIZED("centralized"),
    DISTRIBUTED("distributed");

    private final String wireValue;

    QueenMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static QueenMode fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing queen mode");
        }
        for (QueenMode value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown queen mode: " + raw);
    }
}
