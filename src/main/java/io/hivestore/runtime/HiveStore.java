package io.hivestore.runtime;

import io.hivestore.config.HiveStoreConfig;
import io.hivestore.config.StoreSettings;
import io.hivestore.model.ActiveTask;
import io.hivestore.model.Agent;
import io.hivestore.model.AgentPerformance;
import io.hivestore.model.AgentStatus;
import io.hivestore.model.Communication;
import io.hivestore.model.ConsensusProposal;
import io.hivestore.model.ConsensusStatus;
import io.hivestore.model.ConsensusVote;
import io.hivestore.model.HealthReport;
import io.hivestore.model.MemoryEntry;
import io.hivestore.model.MemoryStats;
import io.hivestore.model.MessageReceipt;
import io.hivestore.model.NamespaceStats;
import io.hivestore.model.PerformanceMetric;
import io.hivestore.model.Swarm;
import io.hivestore.model.SwarmStats;
import io.hivestore.model.SwarmStatus;
import io.hivestore.model.SwarmSummary;
import io.hivestore.model.Task;
import io.hivestore.model.TaskStatus;
import io.hivestore.observability.AuditLogger;
import io.hivestore.storage.AgentRegistry;
import io.hivestore.storage.ColumnUpdate;
import io.hivestore.storage.CommunicationLog;
import io.hivestore.storage.ConsensusEngine;
import io.hivestore.storage.Database;
import io.hivestore.storage.MemoryCache;
import io.hivestore.storage.MetricsLog;
import io.hivestore.storage.ProposalTimedOutException;
import io.hivestore.storage.StoreException;
import io.hivestore.storage.StoreOperation;
import io.hivestore.storage.SwarmRegistry;
import io.hivestore.storage.TaskQueue;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point to the swarm coordination store. Owns the database lifecycle and the
 * optional maintenance sweeper; one instance is created per data root and passed to callers.
 */
public final class HiveStore implements AutoCloseable {
    private static final String ACTOR = "hivestore";

    private final HiveStoreConfig config;
    private final StoreSettings settings;
    private final Clock clock;
    private final Database database;
    private final SwarmRegistry swarms;
    private final AgentRegistry agents;
    private final TaskQueue tasks;
    private final MemoryCache memory;
    private final CommunicationLog communications;
    private final ConsensusEngine consensus;
    private final MetricsLog metrics;
    private final AuditLogger auditLogger;
    private final MaintenanceSweeper sweeper;

    public HiveStore(HiveStoreConfig config) {
        this(config, StoreSettings.load(config.settingsFile()), Clock.systemUTC());
    }

    public HiveStore(HiveStoreConfig config, StoreSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings == null ? StoreSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.database = new Database(config, this.settings);
        this.swarms = new SwarmRegistry(database);
        this.agents = new AgentRegistry(database);
        this.tasks = new TaskQueue(database);
        this.memory = new MemoryCache(database);
        this.communications = new CommunicationLog(database);
        this.consensus = new ConsensusEngine(database);
        this.metrics = new MetricsLog(database);
        this.auditLogger = new AuditLogger(config.auditFile(), this.clock);
        this.sweeper = new MaintenanceSweeper(memory, consensus, this.settings, auditLogger, this.clock);
    }

    public void init() {
        boolean firstOpen = !database.isOpen();
        database.init();
        if (firstOpen) {
            auditLogger.log(AuditLogger.AuditEvent.of("store.init", ACTOR, "db/" + HiveStoreConfig.DB_FILE_NAME, "ok",
                    Map.of("schema_version", Database.SCHEMA_VERSION,
                            "sweep_interval_ms", settings.sweepIntervalMs())));
        }
        sweeper.start();
    }

    public HiveStoreConfig config() {
        return config;
    }

    public StoreSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    // swarms

    public Swarm createSwarm(SwarmRegistry.NewSwarm request) {
        SwarmRegistry.NewSwarm s = new SwarmRegistry.NewSwarm(
                idOrGenerate(request.id(), "swm_"),
                request.name(),
                request.topology(),
                request.queenMode(),
                request.maxAgents(),
                request.consensusThreshold(),
                request.memoryTtlSeconds(),
                request.config()
        );
        Swarm created = swarms.create(s, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of("swarm.create", ACTOR, "swarm/" + created.id(), "ok",
                Map.of("name", created.name(), "topology", created.topology().wireValue())));
        return created;
    }

    public Optional<Swarm> getSwarm(String id) {
        return swarms.get(id);
    }

    public Optional<String> getActiveSwarmId() {
        return swarms.activeSwarmId();
    }

    public boolean setActiveSwarm(String id) {
        boolean activated = swarms.setActive(id, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of("swarm.activate", ACTOR, "swarm/" + id,
                activated ? "ok" : "not_found", Map.of()));
        return activated;
    }

    public List<SwarmSummary> getAllSwarms() {
        return swarms.listWithAgentCount();
    }

    public boolean updateSwarmStatus(String id, SwarmStatus status) {
        boolean updated = swarms.updateStatus(id, status, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of("swarm.status", ACTOR, "swarm/" + id,
                updated ? "ok" : "not_found", Map.of("status", status.wireValue())));
        return updated;
    }

    public SwarmStats getSwarmStats(String swarmId) {
        return swarms.stats(swarmId);
    }

    // agents

    public Agent createAgent(AgentRegistry.NewAgent request) {
        AgentRegistry.NewAgent a = new AgentRegistry.NewAgent(
                idOrGenerate(request.id(), "agt_"),
                request.swarmId(),
                request.name(),
                request.type(),
                request.status(),
                request.capabilities(),
                request.metadata()
        );
        return agents.create(a, clock.millis());
    }

    public Optional<Agent> getAgent(String id) {
        return agents.get(id);
    }

    public List<Agent> getAgents(String swarmId) {
        return agents.listBySwarm(swarmId);
    }

    public boolean updateAgent(String id, Collection<ColumnUpdate> updates) {
        return agents.update(id, updates);
    }

    public boolean updateAgentStatus(String id, AgentStatus status) {
        return agents.updateStatus(id, status, clock.millis());
    }

    public boolean recordAgentOutcome(String id, boolean success) {
        return agents.recordOutcome(id, success, clock.millis());
    }

    public Optional<AgentPerformance> getAgentPerformance(String id) {
        return agents.performance(id);
    }

    // tasks

    public Task createTask(TaskQueue.NewTask request) {
        TaskQueue.NewTask t = new TaskQueue.NewTask(
                idOrGenerate(request.id(), "tsk_"),
                request.swarmId(),
                request.type(),
                request.description(),
                request.status(),
                request.priority(),
                request.assignedAgentId(),
                request.dependencies(),
                request.requirements(),
                request.estimatedDurationMs(),
                request.metadata()
        );
        return tasks.create(t, clock.millis());
    }

    public Optional<Task> getTask(String id) {
        return tasks.get(id);
    }

    public List<Task> getTasks(String swarmId) {
        return tasks.listBySwarm(swarmId);
    }

    public boolean updateTask(String id, Collection<ColumnUpdate> updates) {
        return tasks.update(id, updates);
    }

    public boolean updateTaskStatus(String id, TaskStatus status) {
        return tasks.updateStatus(id, status, clock.millis());
    }

    public List<Task> getPendingTasks(String swarmId) {
        return tasks.listPending(swarmId);
    }

    public List<ActiveTask> getActiveTasks(String swarmId) {
        return tasks.listActive(swarmId);
    }

    public boolean reassignTask(String taskId, String agentId) {
        return tasks.reassign(taskId, agentId, clock.millis());
    }

    // memory

    public void storeMemory(String key, String namespace, String value) {
        memory.store(key, namespace, value, null, null, clock.millis());
    }

    public void storeMemory(String key, String namespace, String value, String metadata, Long ttlSeconds) {
        memory.store(key, namespace, value, metadata, ttlSeconds, clock.millis());
    }

    public Optional<MemoryEntry> getMemory(String key, String namespace) {
        return memory.get(key, namespace, clock.millis());
    }

    public boolean touchMemory(String key, String namespace) {
        return memory.touch(key, namespace, clock.millis());
    }

    public List<MemoryEntry> searchMemory(String namespace, String pattern, int limit) {
        return memory.search(namespace, pattern, limit);
    }

    public boolean deleteMemory(String key, String namespace) {
        return memory.delete(key, namespace);
    }

    public List<MemoryEntry> listMemory(String namespace, int limit) {
        return memory.list(namespace, limit);
    }

    public List<String> getMemoryNamespaces() {
        return memory.namespaces();
    }

    public List<MemoryEntry> getRecentMemoryEntries(int limit) {
        return memory.recent(limit);
    }

    public MemoryStats getMemoryStats() {
        return memory.stats();
    }

    public NamespaceStats getNamespaceStats(String namespace) {
        return memory.namespaceStats(namespace);
    }

    public int deleteOldEntries(String namespace, long maxAgeSeconds) {
        return memory.deleteOlderThan(namespace, maxAgeSeconds, clock.millis());
    }

    public int deleteExpiredMemory(String namespace) {
        return memory.deleteExpired(namespace, clock.millis());
    }

    public int trimNamespace(String namespace, int keep) {
        return memory.trim(namespace, keep);
    }

    public int clearNamespace(String namespace) {
        return memory.clearNamespace(namespace);
    }

    public List<MemoryEntry> getAllMemoryEntries() {
        return memory.listAll();
    }

    public List<MemoryEntry> getOldMemoryEntries(int daysOld) {
        return memory.listCreatedBefore(daysOld, clock.millis());
    }

    public boolean updateMemoryEntry(String key, String namespace, String value, long accessCount, Long lastAccessedAtMs) {
        return memory.updateEntry(key, namespace, value, accessCount, lastAccessedAtMs, clock.millis());
    }

    /**
     * Deletes every memory entry whose metadata belongs to {@code swarmId}, across namespaces.
     */
    public int clearMemory(String swarmId) {
        int deleted = memory.clearForSwarm(swarmId);
        auditLogger.log(AuditLogger.AuditEvent.of("memory.clear", ACTOR, "swarm/" + swarmId, "ok",
                Map.of("deleted_entries", deleted)));
        return deleted;
    }

    public List<MemoryEntry> getSuccessfulDecisions(String swarmId) {
        return memory.successfulDecisions(swarmId);
    }

    // communications

    public Communication createCommunication(CommunicationLog.NewCommunication request) {
        CommunicationLog.NewCommunication m = new CommunicationLog.NewCommunication(
                idOrGenerate(request.id(), "msg_"),
                request.swarmId(),
                request.fromAgentId(),
                request.toAgentId(),
                request.messageType(),
                request.content(),
                request.metadata(),
                request.broadcastScope(),
                request.priority(),
                request.requiresResponse(),
                request.parentMessageId()
        );
        return communications.create(m, clock.millis());
    }

    public Optional<Communication> getCommunication(String id) {
        return communications.get(id);
    }

    public List<Communication> getPendingMessages(String agentId) {
        return communications.pendingFor(agentId);
    }

    public boolean markMessageDelivered(String id) {
        return communications.markDelivered(id, clock.millis());
    }

    public boolean markMessageDelivered(String id, String agentId) {
        return communications.markDelivered(id, agentId, clock.millis());
    }

    public boolean markMessageRead(String id) {
        return communications.markRead(id, clock.millis());
    }

    public boolean markMessageRead(String id, String agentId) {
        return communications.markRead(id, agentId, clock.millis());
    }

    public boolean markMessageAcknowledged(String id) {
        return communications.markAcknowledged(id, clock.millis());
    }

    public boolean markMessageAcknowledged(String id, String agentId) {
        return communications.markAcknowledged(id, agentId, clock.millis());
    }

    public Optional<MessageReceipt> getMessageReceipt(String id, String agentId) {
        return communications.receipt(id, agentId);
    }

    public List<Communication> getRecentMessages(String swarmId, long minutes) {
        return communications.recent(swarmId, minutes, clock.millis());
    }

    // consensus

    public ConsensusProposal createConsensusProposal(ConsensusEngine.NewProposal request) {
        ConsensusEngine.NewProposal p = new ConsensusEngine.NewProposal(
                idOrGenerate(request.id(), "csn_"),
                request.swarmId(),
                request.proposalType(),
                request.proposalData(),
                request.proposedBy(),
                request.thresholdRequired(),
                request.timeoutAtMs()
        );
        return consensus.create(p, clock.millis());
    }

    /**
     * Creates a proposal that inherits the consensus threshold of its swarm.
     *
     * @throws IllegalArgumentException if the swarm does not exist
     */
    public ConsensusProposal createConsensusProposal(
            String swarmId,
            String proposalType,
            String proposalData,
            String proposedBy,
            Long timeoutAtMs
    ) {
        Swarm swarm = swarms.get(swarmId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown swarm: " + swarmId));
        return createConsensusProposal(new ConsensusEngine.NewProposal(null, swarmId, proposalType, proposalData,
                proposedBy, swarm.consensusThreshold(), timeoutAtMs));
    }

    public Optional<ConsensusProposal> getConsensusProposal(String id) {
        return consensus.get(id);
    }

    public Optional<ConsensusEngine.VoteOutcome> submitConsensusVote(String proposalId, String agentId, boolean inFavor, String reason) {
        Optional<ConsensusEngine.VoteOutcome> outcome;
        try {
            outcome = consensus.submitVote(proposalId, agentId, inFavor, reason, clock.millis());
        } catch (ProposalTimedOutException e) {
            auditResolution(e.proposal());
            throw e;
        }
        outcome.filter(ConsensusEngine.VoteOutcome::resolved)
                .ifPresent(o -> auditResolution(o.proposal()));
        return outcome;
    }

    public boolean updateConsensusStatus(String id, ConsensusStatus status) {
        boolean updated = consensus.updateStatus(id, status, clock.millis());
        if (updated) {
            consensus.get(id).ifPresent(this::auditResolution);
        }
        return updated;
    }

    public List<ConsensusProposal> getRecentConsensusProposals(String swarmId, int limit) {
        return consensus.listRecent(swarmId, limit);
    }

    public List<ConsensusVote> getConsensusVotes(String proposalId) {
        return consensus.listVotes(proposalId);
    }

    public int expireConsensusProposals() {
        int expired = consensus.expireOverdue(clock.millis());
        if (expired > 0) {
            auditLogger.log(AuditLogger.AuditEvent.of("consensus.expire", ACTOR, "proposals", "ok",
                    Map.of("timed_out_proposals", expired)));
        }
        return expired;
    }

    // metrics

    public PerformanceMetric storePerformanceMetric(
            String swarmId,
            String agentId,
            String taskId,
            String metricType,
            double metricValue,
            String metadata
    ) {
        PerformanceMetric m = new PerformanceMetric(idOrGenerate(null, "met_"), swarmId, agentId, taskId,
                metricType, metricValue, metadata, clock.millis());
        metrics.append(m);
        return m;
    }

    // maintenance and health

    public MaintenanceSweeper.SweepOutcome runMaintenanceSweep() {
        return sweeper.sweepNow();
    }

    public boolean isSweeperScheduled() {
        return sweeper.isScheduled();
    }

    public List<Database.SchemaMigrationRow> listSchemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public HealthReport healthCheck() {
        String checkedAt = clock.instant().toString();
        try {
            database.queryOne(StoreOperation.PING, rs -> rs.getInt("ok"));
            Map<String, Long> counts = new LinkedHashMap<>();
            counts.put("swarms", database.count(StoreOperation.COUNT_SWARMS));
            counts.put("agents", database.count(StoreOperation.COUNT_AGENTS));
            counts.put("tasks", database.count(StoreOperation.COUNT_TASKS));
            counts.put("memory", database.count(StoreOperation.COUNT_MEMORY));
            counts.put("communications", database.count(StoreOperation.COUNT_COMMUNICATIONS));
            counts.put("consensus", database.count(StoreOperation.COUNT_CONSENSUS));
            counts.put("performance_metrics", database.count(StoreOperation.COUNT_PERFORMANCE_METRICS));
            return new HealthReport(true, Collections.unmodifiableMap(counts), "ok", checkedAt);
        } catch (StoreException e) {
            return new HealthReport(false, Map.of(), e.getMessage(), checkedAt);
        }
    }

    @Override
    public void close() {
        sweeper.close();
        database.close();
    }

    private void auditResolution(ConsensusProposal p) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", p.status().wireValue());
        details.put("votes_for", p.votesFor());
        details.put("votes_against", p.votesAgainst());
        details.put("threshold", p.thresholdRequired());
        auditLogger.log(AuditLogger.AuditEvent.of("consensus.resolve", ACTOR, "proposal/" + p.id(), "ok", details));
    }

    static String idOrGenerate(String id, String prefix) {
        if (id != null && !id.isBlank()) {
            return id;
        }
        return prefix + UUID.randomUUID();
    }
}
