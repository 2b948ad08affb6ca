package io.hivestore.storage;

import io.hivestore.model.BroadcastScope;
import io.hivestore.model.Communication;
import io.hivestore.model.MessagePriority;
import io.hivestore.model.MessageReceipt;
import io.hivestore.model.MessageType;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Inter-agent messages. Direct messages carry their delivery state on the message row;
 * broadcasts keep one receipt per recipient so each agent receives them independently.
 */
public final class CommunicationLog {
    private final Database database;

    public CommunicationLog(Database database) {
        this.database = database;
    }

    /**
     * Stores the message and counts it against the sender in the same transaction.
     */
    public Communication create(NewCommunication m, long nowMs) {
        if (m.content() == null) {
            throw new IllegalArgumentException("Message content must not be null");
        }
        BroadcastScope scope = m.broadcastScope();
        if (scope == null) {
            scope = m.toAgentId() == null ? BroadcastScope.SWARM : BroadcastScope.NONE;
        }
        if (m.toAgentId() == null && scope == BroadcastScope.NONE) {
            throw new IllegalArgumentException("A message without recipient needs a swarm or global broadcast scope");
        }
        MessageType type = m.messageType() == null
                ? (m.toAgentId() == null ? MessageType.BROADCAST : MessageType.DIRECT)
                : m.messageType();
        MessagePriority priority = m.priority() == null ? MessagePriority.MEDIUM : m.priority();
        BroadcastScope finalScope = scope;
        return database.inTransaction("createCommunication", () -> {
            database.update(StoreOperation.CREATE_COMMUNICATION,
                    m.id(),
                    m.swarmId(),
                    m.fromAgentId(),
                    m.toAgentId(),
                    type,
                    m.content(),
                    m.metadata(),
                    finalScope,
                    priority,
                    nowMs,
                    null,
                    null,
                    null,
                    m.requiresResponse(),
                    m.parentMessageId()
            );
            database.update(StoreOperation.INCREMENT_AGENT_MESSAGES, nowMs, m.fromAgentId());
            return new Communication(m.id(), m.swarmId(), m.fromAgentId(), m.toAgentId(), type, m.content(),
                    m.metadata(), finalScope, priority, nowMs, null, null, null, m.requiresResponse(),
                    m.parentMessageId());
        });
    }

    public Optional<Communication> get(String id) {
        return database.queryOne(StoreOperation.GET_COMMUNICATION, CommunicationLog::mapCommunication, id);
    }

    /**
     * Messages waiting for {@code agentId}, most urgent first, then oldest first.
     */
    public List<Communication> pendingFor(String agentId) {
        return database.query(StoreOperation.LIST_PENDING_MESSAGES, CommunicationLog::mapCommunication,
                agentId, agentId, agentId, agentId);
    }

    /**
     * Stamps delivered_at on a direct message. The first stamp wins.
     *
     * @return true if this call set the timestamp
     * @throws IllegalArgumentException if the message is a broadcast; use {@link #markDelivered(String, String, long)}
     */
    public boolean markDelivered(String id, long nowMs) {
        return markRow("markDelivered", id, StoreOperation.MARK_MESSAGE_DELIVERED, nowMs, id);
    }

    /**
     * Delivery to one recipient. Broadcasts get a receipt for that agent; direct messages
     * fall back to the message row.
     */
    public boolean markDelivered(String id, String agentId, long nowMs) {
        Optional<Communication> message = get(id);
        if (message.isEmpty()) {
            return false;
        }
        if (!message.get().isBroadcast()) {
            return markDelivered(id, nowMs);
        }
        return database.update(StoreOperation.RECEIPT_DELIVERED, id, agentId, nowMs) == 1;
    }

    public boolean markRead(String id, long nowMs) {
        return markRow("markRead", id, StoreOperation.MARK_MESSAGE_READ, nowMs, nowMs, id);
    }

    public boolean markRead(String id, String agentId, long nowMs) {
        Optional<Communication> message = get(id);
        if (message.isEmpty()) {
            return false;
        }
        if (!message.get().isBroadcast()) {
            return markRead(id, nowMs);
        }
        return database.update(StoreOperation.RECEIPT_READ, id, agentId, nowMs, nowMs) == 1;
    }

    public boolean markAcknowledged(String id, long nowMs) {
        return markRow("markAcknowledged", id, StoreOperation.MARK_MESSAGE_ACKNOWLEDGED, nowMs, nowMs, nowMs, id);
    }

    public boolean markAcknowledged(String id, String agentId, long nowMs) {
        Optional<Communication> message = get(id);
        if (message.isEmpty()) {
            return false;
        }
        if (!message.get().isBroadcast()) {
            return markAcknowledged(id, nowMs);
        }
        return database.update(StoreOperation.RECEIPT_ACKNOWLEDGED, id, agentId, nowMs, nowMs, nowMs) == 1;
    }

    // broadcast state lives in receipts; the message row stays untouched
    private boolean markRow(String opKey, String id, StoreOperation op, Object... params) {
        return database.inTransaction(opKey, () -> {
            if (database.update(op, params) == 1) {
                return true;
            }
            Optional<Communication> message = get(id);
            if (message.isPresent() && message.get().isBroadcast()) {
                throw new IllegalArgumentException("Message " + id + " is a broadcast; mark it for a recipient agent");
            }
            return false;
        });
    }

    public Optional<MessageReceipt> receipt(String id, String agentId) {
        return database.queryOne(StoreOperation.GET_RECEIPT, rs -> new MessageReceipt(
                rs.getString("message_id"),
                rs.getString("agent_id"),
                Rows.nullableLong(rs, "delivered_at"),
                Rows.nullableLong(rs, "read_at"),
                Rows.nullableLong(rs, "acknowledged_at")
        ), id, agentId);
    }

    /**
     * Messages of a swarm created within the last {@code minutes}, newest first.
     */
    public List<Communication> recent(String swarmId, long minutes, long nowMs) {
        if (minutes < 0L) {
            throw new IllegalArgumentException("Window must not be negative: " + minutes);
        }
        return database.query(StoreOperation.LIST_RECENT_MESSAGES, CommunicationLog::mapCommunication,
                swarmId, nowMs - minutes * 60_000L);
    }

    static Communication mapCommunication(ResultSet rs) throws SQLException {
        return new Communication(
                rs.getString("id"),
                rs.getString("swarm_id"),
                rs.getString("from_agent_id"),
                rs.getString("to_agent_id"),
                MessageType.fromWire(rs.getString("message_type")),
                rs.getString("content"),
                rs.getString("metadata"),
                BroadcastScope.fromWire(rs.getString("broadcast_scope")),
                MessagePriority.fromString(rs.getString("priority")),
                rs.getLong("created_at"),
                Rows.nullableLong(rs, "delivered_at"),
                Rows.nullableLong(rs, "read_at"),
                Rows.nullableLong(rs, "acknowledged_at"),
                Rows.flag(rs, "requires_response"),
                rs.getString("parent_message_id")
        );
    }

    public record NewCommunication(
            String id,
            String swarmId,
            String fromAgentId,
            String toAgentId,
            MessageType messageType,
            String content,
            String metadata,
            BroadcastScope broadcastScope,
            MessagePriority priority,
            boolean requiresResponse,
            String parentMessageId
    ) {
    }
}
