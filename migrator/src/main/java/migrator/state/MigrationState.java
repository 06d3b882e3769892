package migrator.state;

import migrator.metrics.MigrationMetrics;
import migrator.plan.MigrationDirection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Run status of one {@link migrator.engine.Migrator}.
 *
 * <p>Tracks:
 * <ul>
 *   <li>Current run status ({@link Status})</li>
 *   <li>Direction and target of the current or last run</li>
 *   <li>Metrics and error of the last run</li>
 *   <li>A bounded history of recent runs</li>
 * </ul>
 *
 * <p>Written by the migrator's own thread; safe to read from monitoring
 * threads while a run is in progress.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationState state = migrator.state();
 * if (state.getStatus() == Status.FAILED) {
 *     log.warn("Last run failed: {}", state.getLastError());
 * }
 * </pre>
 *
 * @see MigrationHistoryEntry
 */
public final class MigrationState {

    /**
     * Run status.
     */
    public enum Status {
        /** No run has happened yet (or since reset) */
        IDLE,
        /** A run is currently executing */
        IN_PROGRESS,
        /** Last run completed successfully */
        SUCCESS,
        /** Last run failed */
        FAILED
    }

    private static final int DEFAULT_HISTORY_SIZE = 10;

    private volatile int maxHistorySize = DEFAULT_HISTORY_SIZE;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile Status status = Status.IDLE;
    private volatile long currentRunId;
    private volatile MigrationDirection currentDirection;
    private volatile UUID currentTarget;
    private volatile Instant startTime;
    private volatile MigrationMetrics lastMetrics;
    private volatile String lastError;
    private final List<MigrationHistoryEntry> history = new ArrayList<>();

    /**
     * Mark a run as started.
     *
     * @param runId the run identifier
     * @param direction the run direction
     * @param target the requested target, or null for all migrations
     */
    public void runStarted(long runId, MigrationDirection direction, UUID target) {
        lock.writeLock().lock();
        try {
            this.status = Status.IN_PROGRESS;
            this.currentRunId = runId;
            this.currentDirection = direction;
            this.currentTarget = target;
            this.startTime = Instant.now();
            this.lastError = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mark the current run as completed successfully.
     *
     * @param metrics the final run metrics
     */
    public void runCompleted(MigrationMetrics metrics) {
        lock.writeLock().lock();
        try {
            this.status = Status.SUCCESS;
            this.lastMetrics = metrics;
            this.lastError = null;
            addToHistory(MigrationHistoryEntry.success(currentRunId, currentDirection, currentTarget, metrics));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mark the current run as failed.
     *
     * @param error the error that ended the run
     * @param partialMetrics metrics collected before the failure (may be null)
     */
    public void runFailed(Throwable error, MigrationMetrics partialMetrics) {
        lock.writeLock().lock();
        try {
            this.status = Status.FAILED;
            this.lastError = error != null ? error.getMessage() : "Unknown error";
            this.lastMetrics = partialMetrics;
            addToHistory(MigrationHistoryEntry.failure(
                    currentRunId, currentDirection, currentTarget, lastError, partialMetrics));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void addToHistory(MigrationHistoryEntry entry) {
        history.add(0, entry);
        while (history.size() > maxHistorySize) {
            history.remove(history.size() - 1);
        }
    }

    /**
     * Set the maximum number of history entries to keep.
     *
     * @param size the maximum history size, must be positive
     * @throws IllegalArgumentException if size is not positive
     */
    public void setMaxHistorySize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + size);
        }
        lock.writeLock().lock();
        try {
            this.maxHistorySize = size;
            while (history.size() > maxHistorySize) {
                history.remove(history.size() - 1);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public Status getStatus() {
        return status;
    }

    /** Get the current or last run id, or 0 if nothing has run. */
    public long getCurrentRunId() {
        return currentRunId;
    }

    /** Get the direction of the current or last run, or null if nothing has run. */
    public MigrationDirection getCurrentDirection() {
        return currentDirection;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public MigrationMetrics getLastMetrics() {
        return lastMetrics;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Get an unmodifiable view of run history (most recent first).
     */
    public List<MigrationHistoryEntry> getHistory() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Convert the current state to a Map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        lock.readLock().lock();
        try {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("status", status.name());
            map.put("currentRunId", currentRunId);
            map.put("direction", currentDirection != null ? currentDirection.label() : null);
            map.put("target", currentTarget != null ? currentTarget.toString() : null);
            map.put("startTime", startTime != null ? startTime.toString() : null);
            map.put("lastError", lastError);

            if (lastMetrics != null) {
                map.put("lastRun", lastMetrics.toMap());
            }

            return map;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reset state to IDLE and clear history.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            this.status = Status.IDLE;
            this.currentRunId = 0;
            this.currentDirection = null;
            this.currentTarget = null;
            this.startTime = null;
            this.lastMetrics = null;
            this.lastError = null;
            this.history.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
