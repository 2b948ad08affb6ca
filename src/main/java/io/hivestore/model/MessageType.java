package io.hivestore.model;

public enum MessageType implements WireValue {
    DIRECT("direct"),
    BROADCAST("broadcast"),
    CONSENSUS("consensus"),
    QUERY("query"),
    RESPONSE("response"),
    NOTIFICATION("notification");

    private final String wireValue;

    MessageType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public static MessageType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing message type");
        }
        for (MessageType value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
