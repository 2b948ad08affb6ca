package io.hivestore.storage;

import io.hivestore.model.BroadcastScope;
import io.hivestore.model.Communication;
import io.hivestore.model.MessagePriority;
import io.hivestore.model.MessageReceipt;
import io.hivestore.model.MessageType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.hivestore.storage.AgentRegistryTest.agent;
import static io.hivestore.storage.DatabaseTest.deleteRecursively;
import static io.hivestore.storage.DatabaseTest.swarm;
import static io.hivestore.storage.SwarmRegistryTest.open;

final class CommunicationLogTest {

    @Test
    void directMessageIsPendingUntilDelivered() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-direct-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            log.create(direct("msg_1", "agt_a", "agt_b", MessagePriority.MEDIUM), 1_000L);

            Assertions.assertEquals(List.of("msg_1"), ids(log.pendingFor("agt_b")));
            Assertions.assertTrue(log.pendingFor("agt_a").isEmpty());
            Assertions.assertTrue(log.pendingFor("agt_c").isEmpty());

            Assertions.assertTrue(log.markDelivered("msg_1", 2_000L));
            Assertions.assertFalse(log.markDelivered("msg_1", 3_000L));
            Assertions.assertEquals(2_000L, log.get("msg_1").orElseThrow().deliveredAtMs());
            Assertions.assertTrue(log.pendingFor("agt_b").isEmpty());
            Assertions.assertEquals(1L, new AgentRegistry(db).get("agt_a").orElseThrow().messageCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void readAndAcknowledgeFillEarlierTimestamps() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-read-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            log.create(direct("msg_r", "agt_a", "agt_b", MessagePriority.HIGH), 1_000L);
            log.create(direct("msg_ack", "agt_a", "agt_b", MessagePriority.HIGH), 1_000L);

            Assertions.assertTrue(log.markRead("msg_r", 2_000L));
            Communication read = log.get("msg_r").orElseThrow();
            Assertions.assertEquals(2_000L, read.deliveredAtMs());
            Assertions.assertEquals(2_000L, read.readAtMs());
            Assertions.assertFalse(log.markRead("msg_r", 3_000L));

            log.markDelivered("msg_ack", 1_500L);
            Assertions.assertTrue(log.markAcknowledged("msg_ack", 4_000L));
            Communication acked = log.get("msg_ack").orElseThrow();
            Assertions.assertEquals(1_500L, acked.deliveredAtMs());
            Assertions.assertEquals(4_000L, acked.readAtMs());
            Assertions.assertEquals(4_000L, acked.acknowledgedAtMs());
            Assertions.assertTrue(acked.deliveredAtMs() <= acked.readAtMs());
            Assertions.assertTrue(acked.readAtMs() <= acked.acknowledgedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void swarmBroadcastIsDeliveredToEachAgentIndependently() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-broadcast-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            Communication sent = log.create(broadcast("msg_b", BroadcastScope.SWARM), 1_000L);
            Assertions.assertTrue(sent.isBroadcast());
            Assertions.assertEquals(MessageType.BROADCAST, sent.messageType());

            Assertions.assertEquals(List.of("msg_b"), ids(log.pendingFor("agt_b")));
            Assertions.assertEquals(List.of("msg_b"), ids(log.pendingFor("agt_c")));
            Assertions.assertTrue(log.pendingFor("agt_a").isEmpty());
            Assertions.assertTrue(log.pendingFor("agt_x").isEmpty());

            Assertions.assertTrue(log.markDelivered("msg_b", "agt_b", 2_000L));
            Assertions.assertFalse(log.markDelivered("msg_b", "agt_b", 2_500L));
            Assertions.assertTrue(log.pendingFor("agt_b").isEmpty());
            Assertions.assertEquals(List.of("msg_b"), ids(log.pendingFor("agt_c")));
            Assertions.assertNull(log.get("msg_b").orElseThrow().deliveredAtMs());

            Assertions.assertTrue(log.markAcknowledged("msg_b", "agt_c", 3_000L));
            MessageReceipt c = log.receipt("msg_b", "agt_c").orElseThrow();
            Assertions.assertEquals(3_000L, c.deliveredAtMs());
            Assertions.assertEquals(3_000L, c.readAtMs());
            Assertions.assertEquals(3_000L, c.acknowledgedAtMs());
            Assertions.assertTrue(log.pendingFor("agt_c").isEmpty());

            MessageReceipt b = log.receipt("msg_b", "agt_b").orElseThrow();
            Assertions.assertEquals(2_000L, b.deliveredAtMs());
            Assertions.assertNull(b.readAtMs());
            Assertions.assertTrue(log.markRead("msg_b", "agt_b", 4_000L));
            Assertions.assertEquals(2_000L, log.receipt("msg_b", "agt_b").orElseThrow().deliveredAtMs());
            Assertions.assertFalse(log.markDelivered("msg_missing", "agt_b", 4_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void broadcastCannotBeMarkedWithoutARecipient() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-broadcast-row-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            log.create(broadcast("msg_b", BroadcastScope.SWARM), 1_000L);

            Assertions.assertThrows(IllegalArgumentException.class, () -> log.markDelivered("msg_b", 2_000L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> log.markRead("msg_b", 2_000L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> log.markAcknowledged("msg_b", 2_000L));

            Communication row = log.get("msg_b").orElseThrow();
            Assertions.assertNull(row.deliveredAtMs());
            Assertions.assertNull(row.readAtMs());
            Assertions.assertNull(row.acknowledgedAtMs());
            Assertions.assertEquals(List.of("msg_b"), ids(log.pendingFor("agt_b")));
            Assertions.assertEquals(List.of("msg_b"), ids(log.pendingFor("agt_c")));

            Assertions.assertFalse(log.markDelivered("msg_missing", 2_000L));
            Assertions.assertFalse(log.markRead("msg_missing", 2_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void globalBroadcastReachesOtherSwarms() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-global-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            log.create(broadcast("msg_g", BroadcastScope.GLOBAL), 1_000L);
            Assertions.assertEquals(List.of("msg_g"), ids(log.pendingFor("agt_x")));
            Assertions.assertEquals(List.of("msg_g"), ids(log.pendingFor("agt_b")));

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> log.create(broadcast("msg_none", BroadcastScope.NONE), 1_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pendingMessagesAreOrderedByPriorityThenAge() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-order-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            log.create(direct("msg_low", "agt_a", "agt_b", MessagePriority.LOW), 1_000L);
            log.create(direct("msg_med_2", "agt_a", "agt_b", MessagePriority.MEDIUM), 3_000L);
            log.create(direct("msg_urgent", "agt_a", "agt_b", MessagePriority.URGENT), 4_000L);
            log.create(direct("msg_med_1", "agt_a", "agt_b", MessagePriority.MEDIUM), 2_000L);
            log.create(direct("msg_high", "agt_c", "agt_b", MessagePriority.HIGH), 5_000L);

            Assertions.assertEquals(List.of("msg_urgent", "msg_high", "msg_med_1", "msg_med_2", "msg_low"),
                    ids(log.pendingFor("agt_b")));
            Assertions.assertEquals(4L, new AgentRegistry(db).get("agt_a").orElseThrow().messageCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recentMessagesUseAMinuteWindow() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-comm-recent-");
        try (Database db = open(root)) {
            seed(db);
            CommunicationLog log = new CommunicationLog(db);
            log.create(direct("msg_old", "agt_a", "agt_b", MessagePriority.LOW), 0L);
            log.create(direct("msg_new", "agt_a", "agt_b", MessagePriority.LOW), 10 * 60_000L);
            log.create(direct("msg_newer", "agt_a", "agt_c", MessagePriority.LOW), 11 * 60_000L);

            Assertions.assertEquals(List.of("msg_newer", "msg_new"), ids(log.recent("swm_1", 5L, 12 * 60_000L)));
            Assertions.assertTrue(log.recent("swm_2", 60L, 12 * 60_000L).isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class, () -> log.recent("swm_1", -1L, 0L));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void seed(Database db) {
        SwarmRegistry swarms = new SwarmRegistry(db);
        swarms.create(swarm("swm_1"), 1L);
        swarms.create(swarm("swm_2"), 1L);
        AgentRegistry agents = new AgentRegistry(db);
        agents.create(agent("agt_a", "swm_1"), 1L);
        agents.create(agent("agt_b", "swm_1"), 1L);
        agents.create(agent("agt_c", "swm_1"), 1L);
        agents.create(agent("agt_x", "swm_2"), 1L);
    }

    private static CommunicationLog.NewCommunication direct(String id, String from, String to, MessagePriority priority) {
        return new CommunicationLog.NewCommunication(id, "swm_1", from, to, MessageType.DIRECT, "hello " + id,
                null, null, priority, false, null);
    }

    private static CommunicationLog.NewCommunication broadcast(String id, BroadcastScope scope) {
        return new CommunicationLog.NewCommunication(id, "swm_1", "agt_a", null, null, "all hands",
                null, scope, MessagePriority.HIGH, true, null);
    }

    private static List<String> ids(List<Communication> messages) {
        return messages.stream().map(Communication::id).toList();
    }
}
