package io.hivestore.runtime;

import io.hivestore.config.StoreSettings;
import io.hivestore.observability.AuditLogger;
import io.hivestore.storage.ConsensusEngine;
import io.hivestore.storage.MemoryCache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic cleanup of the memory cache and of overdue consensus proposals.
 *
 * <p>Each namespace is swept by at most one caller at a time; a sweep that finds a namespace
 * already being swept skips it and reports it in {@link SweepOutcome#skippedNamespaces()}.
 */
public final class MaintenanceSweeper implements AutoCloseable {
    private final MemoryCache memory;
    private final ConsensusEngine consensus;
    private final StoreSettings settings;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final ConcurrentMap<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;

    public MaintenanceSweeper(
            MemoryCache memory,
            ConsensusEngine consensus,
            StoreSettings settings,
            AuditLogger auditLogger,
            Clock clock
    ) {
        this.memory = memory;
        this.consensus = consensus;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Schedules sweeps at the configured fixed delay. A zero interval leaves the sweeper idle.
     *
     * @return whether a schedule was started
     */
    public synchronized boolean start() {
        long intervalMs = settings.sweepIntervalMs();
        if (intervalMs <= 0L || scheduler != null) {
            return false;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hivestore-maintenance-sweeper");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::scheduledSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        return true;
    }

    public synchronized boolean isScheduled() {
        return scheduler != null;
    }

    public SweepOutcome sweepNow() {
        long nowMs = clock.millis();
        int expired = 0;
        int trimmed = 0;
        List<String> swept = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String namespace : memory.namespaces()) {
            if (!claim(namespace)) {
                skipped.add(namespace);
                continue;
            }
            try {
                expired += memory.deleteExpired(namespace, nowMs);
                int capacity = settings.capacityFor(namespace);
                if (capacity > 0) {
                    trimmed += memory.trim(namespace, capacity);
                }
                swept.add(namespace);
            } finally {
                release(namespace);
            }
        }
        int timedOut = consensus.expireOverdue(nowMs);
        SweepOutcome outcome = new SweepOutcome(expired, trimmed, timedOut, List.copyOf(swept), List.copyOf(skipped));
        if (outcome.changedAnything() || !skipped.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expired_entries", expired);
            details.put("trimmed_entries", trimmed);
            details.put("timed_out_proposals", timedOut);
            details.put("skipped_namespaces", skipped);
            auditLogger.log(AuditLogger.AuditEvent.of("maintenance.sweep", "sweeper", "memory/*", "ok", details));
        }
        return outcome;
    }

    boolean claim(String namespace) {
        return inFlight.computeIfAbsent(namespace, ignored -> new AtomicBoolean(false)).compareAndSet(false, true);
    }

    void release(String namespace) {
        AtomicBoolean flag = inFlight.get(namespace);
        if (flag != null) {
            flag.set(false);
        }
    }

    private void scheduledSweep() {
        try {
            sweepNow();
        } catch (RuntimeException e) {
            // keep the schedule alive; the next run retries
            System.err.println("WARN maintenance sweep failed: " + e.getMessage());
            try {
                auditLogger.log(AuditLogger.AuditEvent.of("maintenance.sweep", "sweeper", "memory/*", "error",
                        Map.of("error", String.valueOf(e.getMessage()))));
            } catch (RuntimeException auditFailure) {
                System.err.println("WARN audit of failed sweep not written: " + auditFailure.getMessage());
            }
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                System.err.println("WARN maintenance sweeper did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            scheduler = null;
        }
    }

    public record SweepOutcome(
            int expiredEntries,
            int trimmedEntries,
            int timedOutProposals,
            List<String> sweptNamespaces,
            List<String> skippedNamespaces
    ) {
        public boolean changedAnything() {
            return expiredEntries > 0 || trimmedEntries > 0 || timedOutProposals > 0;
        }
    }
}
