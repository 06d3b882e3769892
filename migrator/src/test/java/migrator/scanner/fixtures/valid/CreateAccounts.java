package migrator.scanner.fixtures.valid;

import migrator.annotations.SchemaMigration;
import migrator.testing.TestMigration;

@SchemaMigration
public class CreateAccounts extends TestMigration {
    public static final String ID = "bc960dc8-0e4a-4182-a62a-8e776d1e2b30";

    public CreateAccounts() {
        super(ID);
    }
}
