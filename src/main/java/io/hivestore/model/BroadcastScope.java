package io.hivestore.model;

public enum BroadcastScope implements WireValue {
    SWARM("swarm"),
    GLOBAL("global"),
    NONE("none");

    private final String wireValue;

    BroadcastScope(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static BroadcastScope fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing broadcast scope");
        }
        for (BroadcastScope value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown broadcast scope: " + raw);
    }
}
