package io.hivestore.runtime;

import io.hivestore.config.HiveStoreConfig;
import io.hivestore.config.StoreSettings;
import io.hivestore.model.AgentStatus;
import io.hivestore.model.AgentType;
import io.hivestore.model.Communication;
import io.hivestore.model.ConsensusProposal;
import io.hivestore.model.ConsensusStatus;
import io.hivestore.model.HealthReport;
import io.hivestore.model.MemoryEntry;
import io.hivestore.model.QueenMode;
import io.hivestore.model.Swarm;
import io.hivestore.model.Task;
import io.hivestore.model.TaskPriority;
import io.hivestore.model.TaskStatus;
import io.hivestore.model.Topology;
import io.hivestore.storage.AgentRegistry;
import io.hivestore.storage.CommunicationLog;
import io.hivestore.storage.MemoryCache;
import io.hivestore.storage.ProposalTimedOutException;
import io.hivestore.storage.SwarmRegistry;
import io.hivestore.storage.TaskQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

final class HiveStoreTest {

    @Test
    void idleAgentPicksUpTheHighPriorityTask() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-dispatch-");
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        try (HiveStore store = open(root, clock)) {
            Swarm swarm = store.createSwarm(new SwarmRegistry.NewSwarm(null, "mesh-swarm", Topology.MESH,
                    QueenMode.CENTRALIZED, 5, 0.66d, 3_600L, null));
            Assertions.assertTrue(swarm.id().startsWith("swm_"));
            Assertions.assertEquals(5, swarm.maxAgents());

            String agentId = store.createAgent(new AgentRegistry.NewAgent(null, swarm.id(), "worker", AgentType.CODER,
                    AgentStatus.IDLE, List.of("java"), null)).id();
            Assertions.assertTrue(agentId.startsWith("agt_"));

            clock.advance(1_000L);
            Task task = store.createTask(new TaskQueue.NewTask(null, swarm.id(), null, "fix the build", null,
                    TaskPriority.HIGH, null, null, null, null, null));
            Assertions.assertTrue(task.id().startsWith("tsk_"));
            Assertions.assertEquals(List.of(task.id()),
                    store.getPendingTasks(swarm.id()).stream().map(Task::id).toList());

            clock.advance(1_000L);
            Assertions.assertTrue(store.reassignTask(task.id(), agentId));
            Task assigned = store.getTask(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.ASSIGNED, assigned.status());
            Assertions.assertEquals(agentId, assigned.assignedAgentId());
            Assertions.assertEquals(clock.millis(), assigned.assignedAtMs());
            Assertions.assertTrue(store.getPendingTasks(swarm.id()).isEmpty());
            Assertions.assertEquals(1, store.getActiveTasks(swarm.id()).size());
            Assertions.assertEquals(1, store.getSwarmStats(swarm.id()).taskBacklog());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healthReportCountsEveryTable() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-health-");
        MutableClock clock = new MutableClock(1_000_000L);
        try (HiveStore store = open(root, clock)) {
            HealthReport empty = store.healthCheck();
            Assertions.assertTrue(empty.healthy());
            Assertions.assertEquals(List.of("swarms", "agents", "tasks", "memory", "communications", "consensus",
                    "performance_metrics"), List.copyOf(empty.tableCounts().keySet()));
            Assertions.assertEquals(0L, empty.tableCounts().get("swarms"));

            Swarm swarm = store.createSwarm(swarm("swm_h"));
            store.createAgent(agent("agt_1", swarm.id()));
            store.storeMemory("k", "ns", "v");
            Communication message = store.createCommunication(new CommunicationLog.NewCommunication(null, swarm.id(),
                    "agt_1", null, null, "hello", null, null, null, false, null));
            Assertions.assertTrue(message.id().startsWith("msg_"));
            Assertions.assertTrue(store.storePerformanceMetric(swarm.id(), "agt_1", null, "latency_ms", 12.5d, null)
                    .id().startsWith("met_"));

            HealthReport report = store.healthCheck();
            Assertions.assertEquals(1L, report.tableCounts().get("swarms"));
            Assertions.assertEquals(1L, report.tableCounts().get("agents"));
            Assertions.assertEquals(0L, report.tableCounts().get("tasks"));
            Assertions.assertEquals(1L, report.tableCounts().get("memory"));
            Assertions.assertEquals(1L, report.tableCounts().get("communications"));
            Assertions.assertEquals(1L, report.tableCounts().get("performance_metrics"));
            Assertions.assertEquals(Instant.ofEpochMilli(1_000_000L).toString(), report.checkedAt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healthIsReportedUnhealthyAfterClose() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-closed-");
        try {
            HiveStore store = open(root, new MutableClock(1_000L));
            store.close();
            HealthReport report = store.healthCheck();
            Assertions.assertFalse(report.healthy());
            Assertions.assertTrue(report.tableCounts().isEmpty());
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proposalsInheritTheSwarmThresholdAndResolutionsAreAudited() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-consensus-");
        MutableClock clock = new MutableClock(10_000L);
        try (HiveStore store = open(root, clock)) {
            store.createSwarm(new SwarmRegistry.NewSwarm("swm_c", "c", Topology.STAR, QueenMode.CENTRALIZED,
                    5, 0.5d, 3_600L, null));
            store.createAgent(agent("agt_1", "swm_c"));
            store.createAgent(agent("agt_2", "swm_c"));

            ConsensusProposal p = store.createConsensusProposal("swm_c", "leader", null, "agt_1", null);
            Assertions.assertTrue(p.id().startsWith("csn_"));
            Assertions.assertEquals(0.5d, p.thresholdRequired(), 1e-9);
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> store.createConsensusProposal("swm_missing", "leader", null, "agt_1", null));

            clock.advance(10L);
            Assertions.assertTrue(store.submitConsensusVote(p.id(), "agt_1", true, null).orElseThrow().resolved());
            Assertions.assertEquals(ConsensusStatus.ACHIEVED, store.getConsensusProposal(p.id()).orElseThrow().status());
            Assertions.assertTrue(auditLines(store).stream().anyMatch(l -> l.contains("\"consensus.resolve\"")
                    && l.contains("proposal/" + p.id())));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lateVoteIsAuditedAsTimeout() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-timeout-");
        MutableClock clock = new MutableClock(10_000L);
        try (HiveStore store = open(root, clock)) {
            store.createSwarm(swarm("swm_t"));
            store.createAgent(agent("agt_1", "swm_t"));
            ConsensusProposal p = store.createConsensusProposal("swm_t", "merge", null, "agt_1", 15_000L);

            clock.advance(10_000L);
            Assertions.assertThrows(ProposalTimedOutException.class,
                    () -> store.submitConsensusVote(p.id(), "agt_1", true, null));
            Assertions.assertEquals(ConsensusStatus.TIMEOUT, store.getConsensusProposal(p.id()).orElseThrow().status());
            Assertions.assertTrue(auditLines(store).stream().anyMatch(l -> l.contains("\"timeout\"")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiringOverdueProposalsIsAudited() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-expire-");
        MutableClock clock = new MutableClock(10_000L);
        try (HiveStore store = open(root, clock)) {
            store.createSwarm(swarm("swm_e"));
            store.createAgent(agent("agt_1", "swm_e"));
            ConsensusProposal due = store.createConsensusProposal("swm_e", "merge", null, "agt_1", 12_000L);
            store.createConsensusProposal("swm_e", "merge", null, "agt_1", 60_000L);

            Assertions.assertEquals(0, store.expireConsensusProposals());
            Assertions.assertTrue(auditLines(store).stream().noneMatch(l -> l.contains("\"consensus.expire\"")));

            clock.advance(5_000L);
            Assertions.assertEquals(1, store.expireConsensusProposals());
            Assertions.assertEquals(ConsensusStatus.TIMEOUT, store.getConsensusProposal(due.id()).orElseThrow().status());
            List<String> expired = auditLines(store).stream()
                    .filter(l -> l.contains("\"consensus.expire\""))
                    .toList();
            Assertions.assertEquals(1, expired.size());
            Assertions.assertTrue(expired.get(0).contains("\"timed_out_proposals\":1"));
            Assertions.assertEquals(auditLines(store).size(), store.auditLogger().verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void swarmMemoryIsClearedAcrossNamespacesAndDecisionsAreListed() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-memory-");
        MutableClock clock = new MutableClock(10_000L);
        try (HiveStore store = open(root, clock)) {
            String mine = "{\"swarmId\":\"swm_m\"}";
            store.storeMemory("decision/leader", MemoryCache.DECISIONS_NAMESPACE, "agt_1", mine, null);
            clock.advance(10L);
            store.storeMemory("decision/merge", MemoryCache.DECISIONS_NAMESPACE, "yes", mine, null);
            store.storeMemory("scratch", "notes", "x", mine, null);
            store.storeMemory("scratch", "other", "y", "{\"swarmId\":\"swm_other\"}", null);

            Assertions.assertEquals(List.of("decision/merge", "decision/leader"),
                    store.getSuccessfulDecisions("swm_m").stream().map(MemoryEntry::key).toList());
            Assertions.assertEquals(4, store.getAllMemoryEntries().size());
            Assertions.assertTrue(store.updateMemoryEntry("scratch", "other", "z", 3L, clock.millis()));
            Assertions.assertEquals(3L, store.getAllMemoryEntries().stream()
                    .filter(e -> e.namespace().equals("other")).findFirst().orElseThrow().accessCount());

            clock.advance(2 * 86_400_000L);
            Assertions.assertEquals(4, store.getOldMemoryEntries(1).size());
            Assertions.assertTrue(store.getOldMemoryEntries(3).isEmpty());

            Assertions.assertEquals(3, store.clearMemory("swm_m"));
            Assertions.assertEquals(List.of("other"),
                    store.getAllMemoryEntries().stream().map(MemoryEntry::namespace).toList());
            Assertions.assertTrue(auditLines(store).stream().anyMatch(l -> l.contains("\"memory.clear\"")
                    && l.contains("swarm/swm_m")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditChainVerifiesAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-audit-");
        MutableClock clock = new MutableClock(10_000L);
        try (HiveStore store = open(root, clock)) {
            store.createSwarm(swarm("swm_a"));
            store.createSwarm(swarm("swm_b"));
            Assertions.assertTrue(store.setActiveSwarm("swm_b"));
            Assertions.assertFalse(store.setActiveSwarm("swm_nope"));
            Assertions.assertEquals("swm_b", store.getActiveSwarmId().orElseThrow());

            int rows = store.auditLogger().verifyChain();
            Assertions.assertEquals(auditLines(store).size(), rows);
            Assertions.assertTrue(rows >= 5);

            Path file = store.auditLogger().auditFile();
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("swm_a", "swm_z"));
            Files.write(file, lines, StandardCharsets.UTF_8);
            IllegalStateException broken = Assertions.assertThrows(IllegalStateException.class,
                    () -> store.auditLogger().verifyChain());
            Assertions.assertTrue(broken.getMessage().contains("row 2"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopeningTheStoreContinuesTheAuditChain() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-runtime-reopen-");
        MutableClock clock = new MutableClock(10_000L);
        try {
            try (HiveStore store = open(root, clock)) {
                store.createSwarm(swarm("swm_1"));
            }
            try (HiveStore store = open(root, clock)) {
                Assertions.assertTrue(store.getSwarm("swm_1").isPresent());
                store.createSwarm(swarm("swm_2"));
                Assertions.assertEquals(4, store.auditLogger().verifyChain());
                Assertions.assertEquals(1, store.listSchemaMigrations(10).size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void generatedIdsKeepExplicitOnes() {
        Assertions.assertEquals("tsk_given", HiveStore.idOrGenerate("tsk_given", "tsk_"));
        Assertions.assertTrue(HiveStore.idOrGenerate(null, "tsk_").startsWith("tsk_"));
        Assertions.assertTrue(HiveStore.idOrGenerate(" ", "msg_").startsWith("msg_"));
        Assertions.assertNotEquals(HiveStore.idOrGenerate(null, "x"), HiveStore.idOrGenerate(null, "x"));
    }

    static HiveStore open(Path root, Clock clock) {
        HiveStore store = new HiveStore(HiveStoreConfig.fromRoot(root.toString()), StoreSettings.defaults(), clock);
        store.init();
        return store;
    }

    static SwarmRegistry.NewSwarm swarm(String id) {
        return new SwarmRegistry.NewSwarm(id, "swarm " + id, Topology.MESH, QueenMode.CENTRALIZED, 5, 0.66d, 3_600L, null);
    }

    static AgentRegistry.NewAgent agent(String id, String swarmId) {
        return new AgentRegistry.NewAgent(id, swarmId, "agent " + id, AgentType.CODER, null, List.of(), null);
    }

    private static List<String> auditLines(HiveStore store) throws IOException {
        return Files.readAllLines(store.auditLogger().auditFile(), StandardCharsets.UTF_8).stream()
                .filter(l -> !l.isBlank())
                .toList();
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    static final class MutableClock extends Clock {
        private volatile long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long deltaMs) {
            millis += deltaMs;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
