package migrator.state;

import migrator.metrics.MigrationMetrics;
import migrator.metrics.MigrationMetricsCollector;
import migrator.plan.MigrationDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationState")
class MigrationStateTest {

    private static final UUID TARGET = UUID.fromString("9433a432-386f-467e-a59f-a9fb7e249767");

    private MigrationState state;

    @BeforeEach
    void setUp() {
        state = new MigrationState();
    }

    private static MigrationMetrics metrics(long runId) {
        return new MigrationMetricsCollector().start(runId, MigrationDirection.UP, 0).finish();
    }

    @Test
    @DisplayName("starts idle")
    void idle() {
        assertThat(state.getStatus()).isEqualTo(MigrationState.Status.IDLE);
        assertThat(state.getHistory()).isEmpty();
        assertThat(state.getCurrentRunId()).isZero();
    }

    @Test
    @DisplayName("tracks a run from start to success")
    void success() {
        state.runStarted(1L, MigrationDirection.UP, TARGET);
        assertThat(state.getStatus()).isEqualTo(MigrationState.Status.IN_PROGRESS);
        assertThat(state.getStartTime()).isNotNull();

        state.runCompleted(metrics(1L));

        assertThat(state.getStatus()).isEqualTo(MigrationState.Status.SUCCESS);
        assertThat(state.getLastMetrics().runId()).isEqualTo(1L);
        MigrationHistoryEntry entry = state.getHistory().get(0);
        assertThat(entry.runId()).isEqualTo(1L);
        assertThat(entry.direction()).isEqualTo(MigrationDirection.UP);
        assertThat(entry.target()).isEqualTo(TARGET);
        assertThat(entry.errorMessage()).isNull();
    }

    @Test
    @DisplayName("keeps the error of a failed run")
    void failure() {
        state.runStarted(2L, MigrationDirection.DOWN, null);
        state.runFailed(new IllegalStateException("adapter gone"), null);

        assertThat(state.getStatus()).isEqualTo(MigrationState.Status.FAILED);
        assertThat(state.getLastError()).isEqualTo("adapter gone");
        assertThat(state.getHistory().get(0).status()).isEqualTo(MigrationState.Status.FAILED);
        assertThat(state.getHistory().get(0).errorMessage()).isEqualTo("adapter gone");
    }

    @Test
    @DisplayName("history is bounded and most recent first")
    void boundedHistory() {
        state.setMaxHistorySize(2);
        for (long run = 1; run <= 3; run++) {
            state.runStarted(run, MigrationDirection.UP, null);
            state.runCompleted(metrics(run));
        }

        assertThat(state.getHistory()).extracting(MigrationHistoryEntry::runId).containsExactly(3L, 2L);
    }

    @Test
    @DisplayName("shrinking the history drops the oldest entries")
    void shrinkHistory() {
        for (long run = 1; run <= 3; run++) {
            state.runStarted(run, MigrationDirection.UP, null);
            state.runCompleted(metrics(run));
        }

        state.setMaxHistorySize(1);

        assertThat(state.getHistory()).extracting(MigrationHistoryEntry::runId).containsExactly(3L);
        assertThatThrownBy(() -> state.setMaxHistorySize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toMap exposes the current status")
    void toMap() {
        state.runStarted(4L, MigrationDirection.DOWN, TARGET);
        state.runCompleted(metrics(4L));

        var map = state.toMap();

        assertThat(map)
                .containsEntry("status", "SUCCESS")
                .containsEntry("currentRunId", 4L)
                .containsEntry("direction", "down")
                .containsEntry("target", TARGET.toString())
                .containsKey("lastRun");
    }

    @Test
    @DisplayName("reset returns to idle")
    void reset() {
        state.runStarted(5L, MigrationDirection.UP, null);
        state.runFailed(new RuntimeException("x"), null);

        state.reset();

        assertThat(state.getStatus()).isEqualTo(MigrationState.Status.IDLE);
        assertThat(state.getHistory()).isEmpty();
        assertThat(state.getLastError()).isNull();
    }
}
