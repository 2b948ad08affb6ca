package io.hivestore.model;

/**
 * Delivery priority of a message. Lower rank is delivered first.
 */
public enum MessagePriority implements WireValue {
    URGENT("urgent", 1),
    HIGH("high", 2),
    MEDIUM("medium", 3),
    LOW("low", 4);

    private final String wireValue;
    private final int rank;

    MessagePriority(String wireValue, int rank) {
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

    public static MessagePriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        // "normal" is what older senders wrote for the middle band
        if ("normal".equalsIgnoreCase(raw)) {
            return MEDIUM;
        }
        for (MessagePriority value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message priority: " + raw);
    }
}
