package migrator.scanner.fixtures.abstracttype;

import migrator.annotations.SchemaMigration;
import migrator.testing.TestMigration;

@SchemaMigration
public abstract class BaseMigration extends TestMigration {
    protected BaseMigration() {
        super("0940acb1-0e2e-4b99-9d69-2302a9c74524");
    }
}
