package migrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import migrator.Adapter;
import migrator.Migration;
import migrator.alert.MigrationAlertLogger;
import migrator.config.MigratorConfig;
import migrator.config.MigratorConfigLoader;
import migrator.exceptions.DependencyException;
import migrator.exceptions.MigrateException;
import migrator.listener.MigrationContext;
import migrator.listener.MigrationListener;
import migrator.listener.NoopMigrationListener;
import migrator.metrics.MigrationMetrics;
import migrator.metrics.MigrationMetricsCollector;
import migrator.plan.DependencyGraph;
import migrator.plan.MigrationDirection;
import migrator.plan.MigrationPlan;
import migrator.state.MigrationState;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registers migrations into a dependency graph and applies or reverts them
 * through an {@link Adapter}, in dependency order.
 *
 * <ul>
 *   <li>{@link #register(Migration)} / {@link #registerMultiple(Collection)} -
 *   build and validate the graph (unique ids, known dependencies, no cycles)</li>
 *   <li>{@link #up(UUID)} - apply the target and everything it transitively
 *   depends on</li>
 *   <li>{@link #down(UUID)} - revert everything that transitively depends on the
 *   target; the target itself stays applied</li>
 * </ul>
 *
 * <p>Every run re-reads the applied set from the adapter, selects the
 * migrations in the target set whose state has to change, and walks them in
 * the <em>global</em> topological order (reversed for {@code down}). The order
 * is therefore the same whichever target was asked for, so partial runs
 * compose into a consistent end state. The first adapter failure ends the run.
 *
 * <h2>Example:</h2>
 * <pre>
 * JdbcAdapter adapter = new JdbcAdapter(connection);
 * adapter.init();
 *
 * Migrator&lt;JdbcMigration, SQLException&gt; migrator = new Migrator&lt;&gt;(adapter);
 * migrator.registerMultiple(List.of(new CreateUsers(), new AddEmailIndex()));
 * migrator.up();
 * </pre>
 *
 * <p>Not thread-safe: one migrator drives one backing store from one thread.
 *
 * @param <M> the migration type the adapter executes
 * @param <E> the adapter's error type
 * @see Adapter
 * @see MigrationPlan
 */
public final class Migrator<M extends Migration, E extends Exception> {

    private static final Logger log = LoggerFactory.getLogger(Migrator.class);

    private static final AtomicLong RUN_COUNTER = new AtomicLong(1L);

    private final Adapter<M, E> adapter;
    private final DependencyGraph<M> graph = new DependencyGraph<>();
    private final Map<UUID, Integer> idMap = new HashMap<>();
    private final MigrationState state = new MigrationState();

    private MigrationListener listener = NoopMigrationListener.INSTANCE;
    private volatile MigrationMetrics lastMetrics;

    /**
     * Creates a migrator with an empty dependency graph.
     *
     * @param adapter the storage adapter (must not be null)
     */
    public Migrator(Adapter<M, E> adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    // ===== configuration =====

    /**
     * Apply configuration: history size and alert level.
     *
     * @param config the configuration, or null to keep the current settings
     * @return this migrator for method chaining
     */
    public Migrator<M, E> applyConfig(MigratorConfig config) {
        if (config == null) return this;

        state.setMaxHistorySize(config.historySize());
        MigrationAlertLogger.setAlertLevel(config.alertLevel());

        log.debug("Applied config: {}", config);
        return this;
    }

    /**
     * Load configuration from the default classpath resource and apply it.
     *
     * @return this migrator for method chaining
     * @see MigratorConfigLoader#load()
     */
    public Migrator<M, E> loadAndApplyConfig() {
        return applyConfig(MigratorConfigLoader.load());
    }

    /**
     * Set the listener notified around every migration a run applies or reverts.
     *
     * @param listener the listener, or null to remove it
     * @return this migrator for method chaining
     */
    public Migrator<M, E> setListener(MigrationListener listener) {
        this.listener = listener != null ? listener : NoopMigrationListener.INSTANCE;
        return this;
    }

    // ===== registration =====

    /**
     * Register a migration into the dependency graph.
     *
     * <p>All dependencies are resolved before the graph is modified, so a
     * rejected migration leaves the graph exactly as it was.
     *
     * @param migration the migration to register
     * @throws DependencyException {@code DUPLICATE_ID} if the id is already registered,
     *         {@code UNKNOWN_ID} if a dependency is not registered yet,
     *         {@code CYCLE} if the migration depends on itself
     */
    public void register(M migration) throws DependencyException {
        Objects.requireNonNull(migration, "migration");
        registerMultiple(List.of(migration));
    }

    /**
     * Register several migrations at once, in any order.
     *
     * <p>All nodes are added first and all edges resolved afterwards, so a
     * migration may depend on one that comes later in {@code migrations}. If
     * any id is duplicated, any dependency unknown, or any edge would close a
     * cycle, the whole batch is rejected and the graph is left as it was.
     *
     * @param migrations the migrations to register
     * @throws DependencyException describing the first problem found
     */
    public void registerMultiple(Collection<? extends M> migrations) throws DependencyException {
        Objects.requireNonNull(migrations, "migrations");

        Map<UUID, M> batch = new LinkedHashMap<>();
        for (M m : migrations) {
            Objects.requireNonNull(m, "migration");
            UUID id = Objects.requireNonNull(m.id(), "migration id");
            Set<UUID> deps = Objects.requireNonNull(m.dependencies(), () -> "dependencies of " + id);
            for (UUID dep : deps) {
                Objects.requireNonNull(dep, () -> "null dependency id in " + id);
            }
            if (idMap.containsKey(id) || batch.containsKey(id)) {
                throw DependencyException.duplicateId(id);
            }
            batch.put(id, m);
        }

        int mark = graph.size();
        Map<UUID, Integer> added = new LinkedHashMap<>();
        for (M m : batch.values()) {
            added.put(m.id(), graph.addNode(m));
        }

        try {
            for (M m : batch.values()) {
                int node = added.get(m.id());
                for (UUID dep : m.dependencies()) {
                    Integer parent = added.get(dep);
                    if (parent == null) parent = idMap.get(dep);
                    if (parent == null) {
                        throw DependencyException.unknownId(dep);
                    }
                    graph.addEdge(parent, node);
                }
            }
        } catch (DependencyException | RuntimeException e) {
            graph.truncate(mark);
            log.debug("Rejected {} migration(s): {}", batch.size(), e.getMessage());
            throw e;
        }

        idMap.putAll(added);
        for (M m : batch.values()) {
            log.debug("Registered migration {} ({}) depending on {}", m.id(), m.description(), m.dependencies());
        }
    }

    // ===== runs =====

    /**
     * Apply all registered migrations that are not applied yet.
     *
     * @throws MigrateException if reading the applied state or applying a migration fails
     */
    public void up() throws MigrateException {
        up(null);
    }

    /**
     * Apply migrations as necessary so that {@code target} and everything it
     * transitively depends on is applied.
     *
     * @param target the migration to reach, or null for all migrations
     * @throws MigrateException {@code DEPENDENCY} if the target is unknown,
     *         {@code ADAPTER} if the applied state cannot be read,
     *         {@code MIGRATION} if applying one migration failed
     */
    public void up(UUID target) throws MigrateException {
        run(MigrationDirection.UP, target);
    }

    /**
     * Revert all applied migrations.
     *
     * @throws MigrateException if reading the applied state or reverting a migration fails
     */
    public void down() throws MigrateException {
        down(null);
    }

    /**
     * Revert migrations as necessary so that nothing depending on {@code target}
     * is applied. The target itself keeps its state.
     *
     * @param target the revert boundary, or null to revert all migrations
     * @throws MigrateException {@code DEPENDENCY} if the target is unknown,
     *         {@code ADAPTER} if the applied state cannot be read,
     *         {@code MIGRATION} if reverting one migration failed
     */
    public void down(UUID target) throws MigrateException {
        run(MigrationDirection.DOWN, target);
    }

    /**
     * Compute what {@link #up(UUID)} would apply, without applying anything.
     *
     * @param target the migration to reach, or null for all migrations
     * @return the plan
     * @throws MigrateException if the target is unknown or the applied state cannot be read
     */
    public MigrationPlan<M> planUp(UUID target) throws MigrateException {
        return plan(MigrationDirection.UP, target);
    }

    /**
     * Compute what {@link #down(UUID)} would revert, without reverting anything.
     *
     * @param target the revert boundary, or null for all migrations
     * @return the plan
     * @throws MigrateException if the target is unknown or the applied state cannot be read
     */
    public MigrationPlan<M> planDown(UUID target) throws MigrateException {
        return plan(MigrationDirection.DOWN, target);
    }

    /**
     * Returns every registered migration with its applied flag, in topological order.
     *
     * @return migration to applied flag
     * @throws MigrateException {@code ADAPTER} if the applied state cannot be read
     */
    public Map<M, Boolean> status() throws MigrateException {
        Set<UUID> applied = fetchApplied();
        Map<M, Boolean> result = new LinkedHashMap<>();
        for (int idx : graph.toposort()) {
            M m = graph.node(idx);
            result.put(m, applied.contains(m.id()));
        }
        return Collections.unmodifiableMap(result);
    }

    private void run(MigrationDirection direction, UUID target) throws MigrateException {
        long runId = RUN_COUNTER.getAndIncrement();
        state.runStarted(runId, direction, target);

        MigrationPlan<M> plan;
        try {
            plan = plan(direction, target);
        } catch (MigrateException e) {
            MigrationAlertLogger.runFailed(runId, e, null);
            state.runFailed(e, null);
            throw e;
        }

        MigrationAlertLogger.runStarted(runId, direction, target, plan.size());
        log.debug("Run {} plan: {}", runId, plan);

        MigrationContext ctx = new MigrationContext(plan, runId);
        MigrationMetricsCollector collector = new MigrationMetricsCollector().start(runId, direction, plan.size());

        for (M migration : plan.steps()) {
            notifyListener(ctx, migration, true);

            long durationMs;
            try {
                durationMs = collector.timed(migration.id(), () -> execute(direction, migration));
            } catch (Exception e) {
                MigrateException failure = MigrateException.migration(migration, direction, e);
                MigrationMetrics partial = collector.finish();
                lastMetrics = partial;
                MigrationAlertLogger.migrationFailed(runId, direction, migration.id(), migration.description(), e);
                MigrationAlertLogger.runFailed(runId, failure, partial);
                state.runFailed(failure, partial);
                throw failure;
            }

            MigrationAlertLogger.migrationCompleted(runId, direction, migration.id(), durationMs);
            notifyListener(ctx, migration, false);
        }

        MigrationMetrics metrics = collector.finish();
        lastMetrics = metrics;
        MigrationAlertLogger.runCompleted(runId, metrics);
        state.runCompleted(metrics);
        log.debug("Run {} finished: {}", runId, metrics.summary());
    }

    private void execute(MigrationDirection direction, M migration) throws E {
        if (direction == MigrationDirection.UP) {
            adapter.applyMigration(migration);
        } else {
            adapter.revertMigration(migration);
        }
    }

    private MigrationPlan<M> plan(MigrationDirection direction, UUID target) throws MigrateException {
        Set<UUID> targetIds;
        try {
            targetIds = inducedIds(direction, target);
        } catch (DependencyException e) {
            throw MigrateException.dependency(e);
        }

        Set<UUID> applied = fetchApplied();

        List<Integer> order = new ArrayList<>(graph.toposort());
        if (direction == MigrationDirection.DOWN) {
            Collections.reverse(order);
        }

        List<M> steps = new ArrayList<>();
        for (int idx : order) {
            M m = graph.node(idx);
            UUID id = m.id();
            if (!targetIds.contains(id)) continue;

            boolean isApplied = applied.contains(id);
            if (direction == MigrationDirection.UP ? !isApplied : isApplied) {
                steps.add(m);
            }
        }

        return MigrationPlan.of(direction, target, targetIds, steps);
    }

    /**
     * Ids reachable from the target: ancestors for UP, descendants minus the
     * target itself for DOWN. Without a target, everything reachable from the
     * sinks (UP) or the sources (DOWN).
     */
    private Set<UUID> inducedIds(MigrationDirection direction, UUID target) throws DependencyException {
        boolean up = direction == MigrationDirection.UP;
        Set<Integer> indices = new LinkedHashSet<>();

        if (target != null) {
            Integer idx = idMap.get(target);
            if (idx == null) {
                throw DependencyException.unknownId(target);
            }
            indices.addAll(up ? graph.ancestors(idx) : graph.descendants(idx));
        } else if (up) {
            for (int sink : graph.sinks()) {
                indices.addAll(graph.ancestors(sink));
            }
        } else {
            for (int source : graph.sources()) {
                indices.addAll(graph.descendants(source));
            }
        }

        Set<UUID> ids = new LinkedHashSet<>();
        for (int idx : indices) {
            ids.add(graph.node(idx).id());
        }
        if (!up && target != null) {
            ids.remove(target);
        }
        return ids;
    }

    private Set<UUID> fetchApplied() throws MigrateException {
        try {
            return Objects.requireNonNull(adapter.appliedMigrations(), "adapter returned null applied set");
        } catch (Exception e) {
            throw MigrateException.adapter(e);
        }
    }

    private void notifyListener(MigrationContext ctx, M migration, boolean before) {
        try {
            if (before) {
                listener.beforeMigration(ctx, migration);
            } else {
                listener.afterMigration(ctx, migration);
            }
        } catch (RuntimeException e) {
            MigrationAlertLogger.listenerFailed(ctx.runId(), before ? "beforeMigration" : "afterMigration", e);
            log.debug("Listener failure (ignored)", e);
        }
    }

    // ===== queries =====

    /** Returns the adapter this migrator drives. */
    public Adapter<M, E> adapter() {
        return adapter;
    }

    /** Returns true if a migration with {@code id} is registered. */
    public boolean contains(UUID id) {
        return idMap.containsKey(id);
    }

    /**
     * Looks up a registered migration.
     *
     * @param id the migration id
     * @return the migration, or empty if not registered
     */
    public Optional<M> migration(UUID id) {
        Integer idx = idMap.get(id);
        return idx == null ? Optional.empty() : Optional.of(graph.node(idx));
    }

    /** Returns all registered migrations in topological order (dependencies first). */
    public List<M> migrations() {
        List<M> result = new ArrayList<>(graph.size());
        for (int idx : graph.toposort()) {
            result.add(graph.node(idx));
        }
        return Collections.unmodifiableList(result);
    }

    /** Returns the number of registered migrations. */
    public int size() {
        return graph.size();
    }

    /** Returns the run status and history of this migrator. */
    public MigrationState state() {
        return state;
    }

    /**
     * Returns the metrics of the last run that got past planning.
     *
     * @return the metrics, or null if no run has executed
     */
    public MigrationMetrics lastMetrics() {
        return lastMetrics;
    }
}
