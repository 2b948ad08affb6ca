package io.hivestore.model;

public enum Topology implements WireValue {
    MESH("mesh"),
    HIERARCHICAL("hierarchical"),
    RING("ring"),
    STAR("star");

    private final String wireValue;

    Topology(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static Topology fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing topology");
        }
        for (Topology value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown topology: " + raw);
    }
}
