package io.hivestore.model;

/**
 * Per-recipient delivery state of a broadcast message.
 */
public record MessageReceipt(
        String messageId,
        String agentId,
        Long deliveredAtMs,
        Long readAtMs,
        Long acknowledgedAtMs
) {
}
