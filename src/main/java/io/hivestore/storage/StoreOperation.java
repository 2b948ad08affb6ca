package io.hivestore.storage;

import java.util.Locale;

/**
 * Catalog of the fixed, parameterized statements the entity stores run.
 * Each constant is compiled once per connection and cached under {@link #key()}.
 */
public enum StoreOperation {
    // swarms
    CREATE_SWARM("""
            INSERT INTO swarms(id,name,topology,queen_mode,max_agents,consensus_threshold,memory_ttl,config,created_at,updated_at,is_active,status)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
            """),
    GET_SWARM("SELECT * FROM swarms WHERE id=?"),
    GET_ACTIVE_SWARM_ID("SELECT id FROM swarms WHERE is_active=1 ORDER BY updated_at DESC LIMIT 1"),
    CLEAR_ACTIVE_SWARMS("UPDATE swarms SET is_active=0,updated_at=? WHERE is_active=1"),
    ACTIVATE_SWARM("UPDATE swarms SET is_active=1,updated_at=? WHERE id=?"),
    LIST_SWARMS("""
            SELECT s.*,(SELECT COUNT(*) FROM agents a WHERE a.swarm_id=s.id) AS agent_count
            FROM swarms s
            ORDER BY s.created_at DESC, s.rowid DESC
            """),
    UPDATE_SWARM_STATUS("UPDATE swarms SET status=?,updated_at=? WHERE id=?"),
    GET_SWARM_STATS("""
            SELECT
                (SELECT COUNT(*) FROM agents WHERE swarm_id=?) AS agent_count,
                (SELECT COUNT(*) FROM agents WHERE swarm_id=? AND status='busy') AS busy_agents,
                (SELECT COUNT(*) FROM tasks WHERE swarm_id=? AND status IN ('pending','assigned')) AS task_backlog
            """),

    // agents
    CREATE_AGENT("""
            INSERT INTO agents(id,swarm_id,name,type,status,capabilities,current_task_id,message_count,error_count,success_count,created_at,last_active_at,metadata)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
            """),
    GET_AGENT("SELECT * FROM agents WHERE id=?"),
    LIST_AGENTS("SELECT * FROM agents WHERE swarm_id=? ORDER BY created_at, rowid"),
    COUNT_SWARM_AGENTS("SELECT COUNT(*) AS n FROM agents WHERE swarm_id=?"),
    UPDATE_AGENT_STATUS("UPDATE agents SET status=?,last_active_at=? WHERE id=?"),
    RECORD_AGENT_SUCCESS("UPDATE agents SET success_count=success_count+1,last_active_at=? WHERE id=?"),
    RECORD_AGENT_ERROR("UPDATE agents SET error_count=error_count+1,last_active_at=? WHERE id=?"),
    INCREMENT_AGENT_MESSAGES("UPDATE agents SET message_count=message_count+1,last_active_at=? WHERE id=?"),
    GET_AGENT_PERFORMANCE("""
            SELECT
                a.success_count,
                a.error_count,
                (SELECT COUNT(*) FROM tasks WHERE assigned_agent_id=a.id AND status='completed') AS completed_tasks,
                (SELECT COUNT(*) FROM tasks WHERE assigned_agent_id=a.id AND status='failed') AS failed_tasks,
                (SELECT AVG(actual_duration) FROM tasks WHERE assigned_agent_id=a.id AND actual_duration IS NOT NULL) AS avg_completion_time
            FROM agents a
            WHERE a.id=?
            """),

    // tasks
    CREATE_TASK("""
            INSERT INTO tasks(id,swarm_id,type,description,status,priority,assigned_agent_id,dependencies,requirements,result,
                              created_at,assigned_at,started_at,completed_at,estimated_duration,actual_duration,metadata)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            """),
    GET_TASK("SELECT * FROM tasks WHERE id=?"),
    LIST_TASKS("SELECT * FROM tasks WHERE swarm_id=? ORDER BY created_at DESC, rowid DESC"),
    UPDATE_TASK_STATUS("""
            UPDATE tasks
            SET status=?,
                completed_at=?,
                started_at=COALESCE(started_at,?),
                actual_duration=CASE WHEN ? IS NOT NULL AND started_at IS NOT NULL THEN ?-started_at ELSE actual_duration END
            WHERE id=?
            """),
    LIST_PENDING_TASKS("""
            SELECT * FROM tasks
            WHERE swarm_id=? AND status='pending'
            ORDER BY
                CASE priority WHEN 'critical' THEN 1 WHEN 'high' THEN 2 WHEN 'medium' THEN 3 ELSE 4 END,
                created_at,
                rowid
            """),
    LIST_ACTIVE_TASKS("""
            SELECT t.*, a.name AS agent_name
            FROM tasks t
            LEFT JOIN agents a ON t.assigned_agent_id=a.id
            WHERE t.swarm_id=? AND t.status IN ('assigned','in_progress')
            ORDER BY t.created_at, t.rowid
            """),
    REASSIGN_TASK("""
            UPDATE tasks
            SET assigned_agent_id=?,status='assigned',assigned_at=?
            WHERE id=? AND status NOT IN ('completed','failed','cancelled')
            """),

    // memory
    STORE_MEMORY("""
            INSERT INTO memory(key,namespace,value,access_count,last_accessed_at,created_at,updated_at,metadata,ttl)
            VALUES(?,?,?,0,?,?,?,?,?)
            ON CONFLICT(key,namespace) DO UPDATE SET
                value=excluded.value,
                metadata=excluded.metadata,
                ttl=excluded.ttl,
                updated_at=excluded.updated_at
            """),
    GET_MEMORY("SELECT * FROM memory WHERE key=? AND namespace=?"),
    TOUCH_MEMORY("UPDATE memory SET access_count=access_count+1,last_accessed_at=? WHERE key=? AND namespace=?"),
    SEARCH_MEMORY("""
            SELECT * FROM memory
            WHERE namespace=? AND (key LIKE ? ESCAPE '\\' OR value LIKE ? ESCAPE '\\')
            ORDER BY access_count DESC, last_accessed_at DESC, rowid DESC
            LIMIT ?
            """),
    DELETE_MEMORY("DELETE FROM memory WHERE key=? AND namespace=?"),
    LIST_MEMORY("""
            SELECT * FROM memory
            WHERE namespace=?
            ORDER BY access_count DESC, last_accessed_at DESC, rowid DESC
            LIMIT ?
            """),
    LIST_MEMORY_NAMESPACES("SELECT DISTINCT namespace FROM memory ORDER BY namespace"),
    RECENT_MEMORY("SELECT * FROM memory ORDER BY created_at DESC, rowid DESC LIMIT ?"),
    GET_MEMORY_STATS("""
            SELECT
                COUNT(*) AS total_entries,
                COALESCE(SUM(LENGTH(CAST(value AS BLOB))),0) AS total_size,
                COUNT(DISTINCT namespace) AS namespace_count
            FROM memory
            """),
    GET_NAMESPACE_STATS("""
            SELECT
                COUNT(*) AS entry_count,
                COALESCE(SUM(LENGTH(CAST(value AS BLOB))),0) AS total_size,
                AVG(ttl) AS avg_ttl,
                COALESCE(AVG(access_count),0) AS avg_access_count,
                MAX(last_accessed_at) AS last_accessed
            FROM memory
            WHERE namespace=?
            """),
    DELETE_MEMORY_OLDER_THAN("DELETE FROM memory WHERE namespace=? AND created_at<?"),
    DELETE_EXPIRED_MEMORY("DELETE FROM memory WHERE namespace=? AND ttl IS NOT NULL AND updated_at+(ttl*1000)<?"),
    TRIM_NAMESPACE("""
            DELETE FROM memory
            WHERE namespace=? AND rowid NOT IN (
                SELECT rowid FROM memory
                WHERE namespace=?
                ORDER BY access_count DESC, last_accessed_at DESC, rowid DESC
                LIMIT ?
            )
            """),
    CLEAR_NAMESPACE("DELETE FROM memory WHERE namespace=?"),
    LIST_ALL_MEMORY("SELECT * FROM memory ORDER BY namespace, key"),
    LIST_MEMORY_CREATED_BEFORE("SELECT * FROM memory WHERE created_at<? ORDER BY created_at, rowid"),
    UPDATE_MEMORY_ENTRY("""
            UPDATE memory
            SET value=?,access_count=?,last_accessed_at=?,updated_at=?
            WHERE key=? AND namespace=?
            """),
    CLEAR_SWARM_MEMORY("""
            DELETE FROM memory
            WHERE CASE WHEN json_valid(metadata) THEN json_extract(metadata,'$.swarmId') END=?
            """),
    LIST_SWARM_DECISIONS("""
            SELECT * FROM memory
            WHERE namespace=?
              AND key LIKE ? ESCAPE '\\'
              AND CASE WHEN json_valid(metadata) THEN json_extract(metadata,'$.swarmId') END=?
            ORDER BY created_at DESC, rowid DESC
            LIMIT ?
            """),

    // communications
    CREATE_COMMUNICATION("""
            INSERT INTO communications(id,swarm_id,from_agent_id,to_agent_id,message_type,content,metadata,broadcast_scope,priority,
                                       created_at,delivered_at,read_at,acknowledged_at,requires_response,parent_message_id)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            """),
    GET_COMMUNICATION("SELECT * FROM communications WHERE id=?"),
    LIST_PENDING_MESSAGES("""
            SELECT c.* FROM communications c
            WHERE (c.to_agent_id=? AND c.delivered_at IS NULL)
               OR (c.to_agent_id IS NULL
                   AND c.from_agent_id<>?
                   AND (c.broadcast_scope='global'
                        OR (c.broadcast_scope='swarm' AND c.swarm_id=(SELECT a.swarm_id FROM agents a WHERE a.id=?)))
                   AND NOT EXISTS (
                       SELECT 1 FROM communication_receipts r
                       WHERE r.message_id=c.id AND r.agent_id=? AND r.delivered_at IS NOT NULL
                   ))
            ORDER BY
                CASE c.priority WHEN 'urgent' THEN 1 WHEN 'high' THEN 2 WHEN 'medium' THEN 3 ELSE 4 END,
                c.created_at,
                c.rowid
            """),
    MARK_MESSAGE_DELIVERED("""
            UPDATE communications
            SET delivered_at=?
            WHERE id=? AND to_agent_id IS NOT NULL AND delivered_at IS NULL
            """),
    MARK_MESSAGE_READ("""
            UPDATE communications
            SET read_at=?,delivered_at=COALESCE(delivered_at,?)
            WHERE id=? AND to_agent_id IS NOT NULL AND read_at IS NULL
            """),
    MARK_MESSAGE_ACKNOWLEDGED("""
            UPDATE communications
            SET acknowledged_at=?,read_at=COALESCE(read_at,?),delivered_at=COALESCE(delivered_at,?)
            WHERE id=? AND to_agent_id IS NOT NULL AND acknowledged_at IS NULL
            """),
    RECEIPT_DELIVERED("""
            INSERT INTO communication_receipts(message_id,agent_id,delivered_at) VALUES(?,?,?)
            ON CONFLICT(message_id,agent_id) DO UPDATE SET delivered_at=excluded.delivered_at
            WHERE communication_receipts.delivered_at IS NULL
            """),
    RECEIPT_READ("""
            INSERT INTO communication_receipts(message_id,agent_id,delivered_at,read_at) VALUES(?,?,?,?)
            ON CONFLICT(message_id,agent_id) DO UPDATE SET
                read_at=excluded.read_at,
                delivered_at=COALESCE(communication_receipts.delivered_at,excluded.delivered_at)
            WHERE communication_receipts.read_at IS NULL
            """),
    RECEIPT_ACKNOWLEDGED("""
            INSERT INTO communication_receipts(message_id,agent_id,delivered_at,read_at,acknowledged_at) VALUES(?,?,?,?,?)
            ON CONFLICT(message_id,agent_id) DO UPDATE SET
                acknowledged_at=excluded.acknowledged_at,
                read_at=COALESCE(communication_receipts.read_at,excluded.read_at),
                delivered_at=COALESCE(communication_receipts.delivered_at,excluded.delivered_at)
            WHERE communication_receipts.acknowledged_at IS NULL
            """),
    GET_RECEIPT("SELECT * FROM communication_receipts WHERE message_id=? AND agent_id=?"),
    LIST_RECENT_MESSAGES("""
            SELECT * FROM communications
            WHERE swarm_id=? AND created_at>?
            ORDER BY created_at DESC, rowid DESC
            """),

    // consensus
    CREATE_PROPOSAL("""
            INSERT INTO consensus(id,swarm_id,proposal_type,proposal_data,proposed_by,threshold_required,
                                  votes_for,votes_against,votes_total,status,created_at,resolved_at,timeout_at)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
            """),
    GET_PROPOSAL("SELECT * FROM consensus WHERE id=?"),
    HAS_VOTED("SELECT 1 AS voted FROM consensus_votes WHERE proposal_id=? AND agent_id=?"),
    RECORD_VOTE("INSERT INTO consensus_votes(proposal_id,agent_id,vote,reason,created_at) VALUES(?,?,?,?,?)"),
    APPLY_VOTE("""
            UPDATE consensus
            SET votes_for=votes_for+?,votes_against=votes_against+?,votes_total=votes_total+1
            WHERE id=? AND status='pending'
            """),
    RESOLVE_PROPOSAL("UPDATE consensus SET status=?,resolved_at=? WHERE id=? AND status='pending'"),
    EXPIRE_PROPOSALS("""
            UPDATE consensus
            SET status='timeout',resolved_at=?
            WHERE status='pending' AND timeout_at IS NOT NULL AND timeout_at<=?
            """),
    LIST_RECENT_PROPOSALS("SELECT * FROM consensus WHERE swarm_id=? ORDER BY created_at DESC, rowid DESC LIMIT ?"),
    LIST_VOTES("SELECT * FROM consensus_votes WHERE proposal_id=? ORDER BY created_at, rowid"),

    // performance metrics
    STORE_PERFORMANCE_METRIC("""
            INSERT INTO performance_metrics(id,swarm_id,agent_id,task_id,metric_type,metric_value,metadata,created_at)
            VALUES(?,?,?,?,?,?,?,?)
            """),

    // health
    PING("SELECT 1 AS ok"),
    COUNT_SWARMS("SELECT COUNT(*) AS n FROM swarms"),
    COUNT_AGENTS("SELECT COUNT(*) AS n FROM agents"),
    COUNT_TASKS("SELECT COUNT(*) AS n FROM tasks"),
    COUNT_MEMORY("SELECT COUNT(*) AS n FROM memory"),
    COUNT_COMMUNICATIONS("SELECT COUNT(*) AS n FROM communications"),
    COUNT_CONSENSUS("SELECT COUNT(*) AS n FROM consensus"),
    COUNT_PERFORMANCE_METRICS("SELECT COUNT(*) AS n FROM performance_metrics");

    private final String sql;
    private final String key;

    StoreOperation(String sql) {
        this.sql = sql;
        this.key = camelCase(name());
    }

    public String sql() {
        return sql;
    }

    /**
     * Statement cache key, e.g. {@code createSwarm} for {@link #CREATE_SWARM}.
     */
    public String key() {
        return key;
    }

    private static String camelCase(String constant) {
        StringBuilder sb = new StringBuilder(constant.length());
        boolean upper = false;
        for (char ch : constant.toLowerCase(Locale.ROOT).toCharArray()) {
            if (ch == '_') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(ch) : ch);
            upper = false;
        }
        return sb.toString();
    }
}
