package migrator.exceptions;

import migrator.plan.MigrationDirection;
import migrator.testing.TestMigration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrateException")
class MigrateExceptionTest {

    private static final UUID ID = UUID.fromString("c5d07448-851f-45e8-8fa7-4823d5250609");

    @Nested
    @DisplayName("dependency")
    class DependencyErrors {

        @Test
        @DisplayName("keeps the dependency error as cause and its id")
        void wrapsCause() {
            DependencyException cause = DependencyException.unknownId(ID);

            MigrateException ex = MigrateException.dependency(cause);

            assertThat(ex.getKind()).isEqualTo(MigrateException.Kind.DEPENDENCY);
            assertThat(ex.getCause()).isSameAs(cause);
            assertThat(ex.getMigrationId()).isEqualTo(ID);
            assertThat(ex.getMessage())
                    .isEqualTo("An error occurred due to migration dependencies: Unknown migration ID " + ID);
            assertThat(ex.getDirection()).isNull();
        }
    }

    @Nested
    @DisplayName("adapter")
    class AdapterErrors {

        @Test
        @DisplayName("has no migration attribution")
        void noAttribution() {
            IOException cause = new IOException("connection reset");

            MigrateException ex = MigrateException.adapter(cause);

            assertThat(ex.getKind()).isEqualTo(MigrateException.Kind.ADAPTER);
            assertThat(ex.getCause()).isSameAs(cause);
            assertThat(ex.getMigrationId()).isNull();
            assertThat(ex.getDescription()).isNull();
            assertThat(ex.getMessage()).endsWith("connection reset");
        }
    }

    @Nested
    @DisplayName("migration")
    class MigrationErrors {

        @Test
        @DisplayName("names the migration, its description and the direction")
        void attribution() {
            TestMigration migration = new TestMigration(ID.toString());
            IOException cause = new IOException("table exists");

            MigrateException ex = MigrateException.migration(migration, MigrationDirection.DOWN, cause);

            assertThat(ex.getKind()).isEqualTo(MigrateException.Kind.MIGRATION);
            assertThat(ex.getMigrationId()).isEqualTo(ID);
            assertThat(ex.getDescription()).isEqualTo("Test Migration");
            assertThat(ex.getDirection()).isEqualTo(MigrationDirection.DOWN);
            assertThat(ex.getMessage()).isEqualTo(
                    "An error occurred while applying migration " + ID + " (Test Migration) down: table exists.");
        }

        @Test
        @DisplayName("requires a cause")
        void requiresCause() {
            TestMigration migration = new TestMigration(ID.toString());

            assertThatThrownBy(() -> MigrateException.migration(migration, MigrationDirection.UP, null))
                    .isInstanceOf(NullPointerException.class);
        }
    }
}
