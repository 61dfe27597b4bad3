package io.laneboard.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.laneboard.config.BoardSettings;
import io.laneboard.config.LaneBoardConfig;
import io.laneboard.engine.BoardRouter;
import io.laneboard.engine.DependencyEngine;
import io.laneboard.engine.TransitionEngine;
import io.laneboard.events.InProcessEventBroadcaster;
import io.laneboard.lock.SqliteLockManager;
import io.laneboard.model.Author;
import io.laneboard.observability.AuditLogger;
import io.laneboard.storage.BoardStore;
import io.laneboard.storage.Database;
import io.laneboard.tools.BoardToolDispatcher;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

public final class LaneBoardRuntime implements AutoCloseable {
    private final LaneBoardConfig config;
    private final BoardSettings settings;
    private final Database database;
    private final BoardStore boardStore;
    private final InProcessEventBroadcaster events;
    private final AuditLogger auditLogger;
    private final TransitionEngine engine;
    private final BoardToolDispatcher dispatcher;
    private final AtomicLong maintenanceRuns;
    private final AtomicLong maintenanceFailures;
    private final AtomicReference<TransitionEngine.MaintenanceReport> lastMaintenance;
    private ScheduledExecutorService maintenanceScheduler;

    public LaneBoardRuntime(LaneBoardConfig config) {
        this(config, BoardSettings.load(config.settingsFile()), Author.AI, Clock.systemUTC());
    }

    public LaneBoardRuntime(LaneBoardConfig config, Author actor) {
        this(config, BoardSettings.load(config.settingsFile()), actor, Clock.systemUTC());
    }

    public LaneBoardRuntime(LaneBoardConfig config, BoardSettings settings, Author actor, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.boardStore = new BoardStore(database);
        this.events = new InProcessEventBroadcaster();
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), clock);
        Author effectiveActor = actor == null ? Author.AI : actor;
        String lockOwner = "laneboard-" + ProcessHandle.current().pid() + "-" + effectiveActor.wireName();
        this.engine = new TransitionEngine(
                boardStore,
                new BoardRouter(boardStore, settings),
                new DependencyEngine(),
                new SqliteLockManager(database, lockOwner, settings.lockTimeoutMs(), settings.lockLeaseMs(), clock),
                events,
                auditLogger,
                settings,
                clock,
                () -> effectiveActor
        );
        this.dispatcher = new BoardToolDispatcher(engine);
        this.maintenanceRuns = new AtomicLong(0L);
        this.maintenanceFailures = new AtomicLong(0L);
        this.lastMaintenance = new AtomicReference<>();
    }

    public void init() {
        database.init();
    }

    public LaneBoardConfig config() {
        return config;
    }

    public BoardSettings settings() {
        return settings;
    }

    public TransitionEngine engine() {
        return engine;
    }

    public BoardToolDispatcher dispatcher() {
        return dispatcher;
    }

    public InProcessEventBroadcaster events() {
        return events;
    }

    public TransitionEngine.MaintenanceReport runMaintenance() {
        TransitionEngine.MaintenanceReport report = engine.runMaintenance();
        maintenanceRuns.incrementAndGet();
        lastMaintenance.set(report);
        auditLogger.log(AuditLogger.AuditEvent.ok(null, "maintenance", "scheduler", null, null, Map.of(
                "boards", report.boards(),
                "archived", report.archived(),
                "purged", report.purged()
        )));
        return report;
    }

    /**
     * Runs {@link #runMaintenance()} every {@code interval} until {@link #close()}. A failed run
     * is audited and the schedule continues.
     */
    public synchronized void startMaintenance(Duration interval) {
        if (maintenanceScheduler != null) {
            return;
        }
        long periodMs = Math.max(1_000L, interval.toMillis());
        maintenanceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "laneboard-maintenance");
            t.setDaemon(true);
            return t;
        });
        maintenanceScheduler.scheduleWithFixedDelay(() -> {
            try {
                runMaintenance();
            } catch (RuntimeException e) {
                maintenanceFailures.incrementAndGet();
                auditLogger.log(AuditLogger.AuditEvent.rejected(null, "maintenance", "scheduler", null,
                        "MAINTENANCE_FAILED", Map.of("error", String.valueOf(e.getMessage()))));
            }
        }, 0L, periodMs, TimeUnit.MILLISECONDS);
    }

    public RuntimeStats stats() {
        InProcessEventBroadcaster.Stats eventStats = events.stats();
        return new RuntimeStats(
                config.namespace(),
                boardStore.list().size(),
                maintenanceRuns.get(),
                maintenanceFailures.get(),
                lastMaintenance.get(),
                eventStats
        );
    }

    public List<JsonNode> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public int verifyAudit() {
        return auditLogger.verifyChain();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    @Override
    public synchronized void close() {
        if (maintenanceScheduler != null) {
            maintenanceScheduler.shutdownNow();
            maintenanceScheduler = null;
        }
        events.close();
    }

    public record RuntimeStats(
            String namespace,
            int boards,
            long maintenanceRuns,
            long maintenanceFailures,
            TransitionEngine.MaintenanceReport lastMaintenance,
            InProcessEventBroadcaster.Stats events
    ) {
    }
}
