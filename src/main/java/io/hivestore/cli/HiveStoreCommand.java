package io.hivestore.cli;

import io.hivestore.config.HiveStoreConfig;
import io.hivestore.model.HealthReport;
import io.hivestore.model.MemoryStats;
import io.hivestore.model.NamespaceStats;
import io.hivestore.runtime.HiveStore;
import io.hivestore.runtime.MaintenanceSweeper;
import io.hivestore.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "hivestore",
        mixinStandardHelpOptions = true,
        description = "HiveStore swarm coordination store CLI",
        subcommands = {
                HiveStoreCommand.InitCommand.class,
                HiveStoreCommand.HealthCommand.class,
                HiveStoreCommand.SwarmsCommand.class,
                HiveStoreCommand.ActivateSwarmCommand.class,
                HiveStoreCommand.SwarmStatsCommand.class,
                HiveStoreCommand.PendingTasksCommand.class,
                HiveStoreCommand.MemoryStatsCommand.class,
                HiveStoreCommand.MemoryTrimCommand.class,
                HiveStoreCommand.SweepCommand.class,
                HiveStoreCommand.AuditVerifyCommand.class,
                HiveStoreCommand.SchemaMigrationsCommand.class
        }
)
public final class HiveStoreCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = HiveStoreConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | health | swarms | activate-swarm | swarm-stats | pending-tasks | memory-stats | memory-trim | sweep | audit-verify | schema-migrations");
    }

    HiveStore store() {
        HiveStore store = new HiveStore(HiveStoreConfig.fromRoot(root));
        store.init();
        return store;
    }

    @Command(name = "init", description = "Create the data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                System.out.println("Initialized HiveStore at: " + store.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Show table row counts and store health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                HealthReport report = store.healthCheck();
                System.out.println(Jsons.toJson(report));
                return report.healthy() ? 0 : 1;
            }
        }
    }

    @Command(name = "swarms", description = "List swarms with their agent counts, newest first")
    static final class SwarmsCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                System.out.println(Jsons.toJson(store.getAllSwarms()));
            }
            return 0;
        }
    }

    @Command(name = "activate-swarm", description = "Make one swarm the only active swarm")
    static final class ActivateSwarmCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Parameters(index = "0", description = "Swarm id")
        String swarmId;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                if (!store.setActiveSwarm(swarmId)) {
                    System.out.println("{\"error\":\"swarm not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(Map.of("active_swarm_id", swarmId)));
                return 0;
            }
        }
    }

    @Command(name = "swarm-stats", description = "Show agent utilization and task backlog of a swarm")
    static final class SwarmStatsCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Swarm id; defaults to the active swarm")
        String swarmId;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                String target = swarmId != null ? swarmId : store.getActiveSwarmId().orElse(null);
                if (target == null) {
                    System.out.println("{\"error\":\"no active swarm\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(store.getSwarmStats(target)));
                return 0;
            }
        }
    }

    @Command(name = "pending-tasks", description = "List pending tasks of a swarm in dispatch order")
    static final class PendingTasksCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Parameters(index = "0", description = "Swarm id")
        String swarmId;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                System.out.println(Jsons.toJson(store.getPendingTasks(swarmId)));
            }
            return 0;
        }
    }

    @Command(name = "memory-stats", description = "Show memory cache totals, or the stats of one namespace")
    static final class MemoryStatsCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Option(names = {"--namespace"}, description = "Namespace to inspect")
        String namespace;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                if (namespace != null && !namespace.isBlank()) {
                    NamespaceStats stats = store.getNamespaceStats(namespace);
                    System.out.println(Jsons.toJson(stats));
                } else {
                    MemoryStats stats = store.getMemoryStats();
                    System.out.println(Jsons.toJson(stats));
                }
            }
            return 0;
        }
    }

    @Command(name = "memory-trim", description = "Keep only the best-ranked entries of a namespace")
    static final class MemoryTrimCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Parameters(index = "0", description = "Namespace")
        String namespace;

        @Option(names = {"--keep"}, required = true, description = "Number of entries to keep")
        int keep;

        @Override
        public Integer call() {
            if (keep < 0) {
                System.out.println("{\"error\":\"--keep must not be negative\"}");
                return 2;
            }
            try (HiveStore store = parent.store()) {
                int deleted = store.trimNamespace(namespace, keep);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("namespace", namespace);
                out.put("kept", keep);
                out.put("deleted", deleted);
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "sweep", description = "Run one maintenance sweep (expired memory, capacity trim, consensus timeouts)")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                MaintenanceSweeper.SweepOutcome out = store.runMaintenanceSweep();
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("file", store.auditLogger().auditFile().toString());
                try {
                    out.put("ok", true);
                    out.put("rows", store.auditLogger().verifyChain());
                    System.out.println(Jsons.toJson(out));
                    return 0;
                } catch (IllegalStateException e) {
                    out.put("ok", false);
                    out.put("error", e.getMessage());
                    System.out.println(Jsons.toJson(out));
                    return 1;
                }
            }
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        HiveStoreCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (HiveStore store = parent.store()) {
                System.out.println(Jsons.toJson(store.listSchemaMigrations(limit)));
            }
            return 0;
        }
    }
}
