package io.hivestore.model;

public record Communication(
        String id,
        String swarmId,
        String fromAgentId,
        String toAgentId,
        MessageType messageType,
        String content,
        String metadata,
        BroadcastScope broadcastScope,
        MessagePriority priority,
        long createdAtMs,
        Long deliveredAtMs,
        Long readAtMs,
        Long acknowledgedAtMs,
        boolean requiresResponse,
        String parentMessageId
) {
    public boolean isBroadcast() {
        return toAgentId == null;
    }
}
