package migrator.testing;

import migrator.AbstractMigration;

import java.util.Set;
import java.util.UUID;

/**
 * Trivial migration with no actions of its own.
 *
 * <p>Adapters can subclass it and implement their own migration interface
 * with no-op actions to obtain mock migrations for {@link AdapterScenarios}.
 */
public class TestMigration extends AbstractMigration {

    public TestMigration(UUID id, Set<UUID> dependencies) {
        super(id, "Test Migration", dependencies);
    }

    public TestMigration(String id, String... dependencies) {
        super(id, "Test Migration", dependencies);
    }
}
