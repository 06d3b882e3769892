package migrator.scanner.fixtures.valid;

import migrator.annotations.SchemaMigration;
import migrator.testing.TestMigration;

@SchemaMigration
public class AddAccountEmail extends TestMigration {
    public static final String ID = "4885e8ab-dafa-4d76-a565-2dee8b04ef60";

    public AddAccountEmail() {
        super(ID, CreateAccounts.ID);
    }
}
