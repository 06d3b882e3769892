package migrator.testing;

import migrator.Adapter;
import migrator.Migration;
import migrator.engine.Migrator;

import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Generic scenarios any {@link Adapter} implementation should pass.
 *
 * <p>Each scenario expects a fresh adapter with an empty applied set and
 * drives it through a {@link Migrator}. Failures are reported as
 * {@link AssertionError}, so the scenarios can be called from any test
 * framework:
 *
 * <pre>
 * {@literal @}Test
 * void branchingDag() throws Exception {
 *     AdapterScenarios.branchingDag(newAdapter(), NoopJdbcMigration::new);
 * }
 * </pre>
 */
public final class AdapterScenarios {

    /** Creates a mock migration of the adapter's migration type. */
    @FunctionalInterface
    public interface MockFactory<M extends Migration> {
        M mock(UUID id, Set<UUID> dependencies);
    }

    static final UUID ID_1 = UUID.fromString("bc960dc8-0e4a-4182-a62a-8e776d1e2b30");
    static final UUID ID_2 = UUID.fromString("4885e8ab-dafa-4d76-a565-2dee8b04ef60");
    static final UUID ID_3 = UUID.fromString("c5d07448-851f-45e8-8fa7-4823d5250609");
    static final UUID ID_4 = UUID.fromString("9433a432-386f-467e-a59f-a9fb7e249767");
    static final UUID ID_5 = UUID.fromString("0940acb1-0e2e-4b99-9d69-2302a9c74524");

    private AdapterScenarios() {
    }

    /**
     * Runs every scenario, each against a new adapter from {@code adapters}.
     */
    public static <M extends Migration, E extends Exception> void runAll(
            Supplier<? extends Adapter<M, E>> adapters, MockFactory<M> factory) throws Exception {
        singleMigration(adapters.get(), factory);
        migrationChain(adapters.get(), factory);
        multiComponentDag(adapters.get(), factory);
        branchingDag(adapters.get(), factory);
    }

    /** Applies and reverts a single migration. */
    public static <M extends Migration, E extends Exception> void singleMigration(
            Adapter<M, E> adapter, MockFactory<M> factory) throws Exception {
        Migrator<M, E> migrator = new Migrator<>(adapter);
        migrator.register(factory.mock(ID_1, Set.of()));

        migrator.up();
        expectApplied(adapter, Set.of(ID_1), Set.of());

        migrator.down();
        expectApplied(adapter, Set.of(), Set.of(ID_1));
    }

    /** Partially applies and reverts a chain 1 -> 2 -> 3. */
    public static <M extends Migration, E extends Exception> void migrationChain(
            Adapter<M, E> adapter, MockFactory<M> factory) throws Exception {
        Migrator<M, E> migrator = new Migrator<>(adapter);
        migrator.register(factory.mock(ID_1, Set.of()));
        migrator.register(factory.mock(ID_2, Set.of(ID_1)));
        migrator.register(factory.mock(ID_3, Set.of(ID_2)));

        migrator.up(ID_2);
        expectApplied(adapter, Set.of(ID_1, ID_2), Set.of(ID_3));

        migrator.down(ID_1);
        expectApplied(adapter, Set.of(ID_1), Set.of(ID_2, ID_3));
    }

    /** Checks that the components {1 -> 2} and {3 -> 4} move independently. */
    public static <M extends Migration, E extends Exception> void multiComponentDag(
            Adapter<M, E> adapter, MockFactory<M> factory) throws Exception {
        Migrator<M, E> migrator = new Migrator<>(adapter);
        migrator.register(factory.mock(ID_1, Set.of()));
        migrator.register(factory.mock(ID_2, Set.of(ID_1)));
        migrator.register(factory.mock(ID_3, Set.of()));
        migrator.register(factory.mock(ID_4, Set.of(ID_3)));

        migrator.up(ID_2);
        expectApplied(adapter, Set.of(ID_1, ID_2), Set.of(ID_3, ID_4));

        migrator.down(ID_1);
        expectApplied(adapter, Set.of(ID_1), Set.of(ID_2, ID_3, ID_4));

        migrator.up(ID_3);
        expectApplied(adapter, Set.of(ID_1, ID_3), Set.of(ID_2, ID_4));

        migrator.up();
        expectApplied(adapter, Set.of(ID_1, ID_2, ID_3, ID_4), Set.of());

        migrator.down();
        expectApplied(adapter, Set.of(), Set.of(ID_1, ID_2, ID_3, ID_4));
    }

    /** 1, 2; 3 depends on both; 4 and 5 depend on 3. */
    public static <M extends Migration, E extends Exception> void branchingDag(
            Adapter<M, E> adapter, MockFactory<M> factory) throws Exception {
        Migrator<M, E> migrator = new Migrator<>(adapter);
        migrator.register(factory.mock(ID_1, Set.of()));
        migrator.register(factory.mock(ID_2, Set.of()));
        migrator.register(factory.mock(ID_3, Set.of(ID_1, ID_2)));
        migrator.register(factory.mock(ID_4, Set.of(ID_3)));
        migrator.register(factory.mock(ID_5, Set.of(ID_3)));

        migrator.up(ID_4);
        expectApplied(adapter, Set.of(ID_1, ID_2, ID_3, ID_4), Set.of(ID_5));

        migrator.down(ID_1);
        expectApplied(adapter, Set.of(ID_1, ID_2), Set.of(ID_3, ID_4, ID_5));
    }

    private static void expectApplied(Adapter<?, ?> adapter, Set<UUID> present, Set<UUID> absent) throws Exception {
        Set<UUID> applied = adapter.appliedMigrations();
        for (UUID id : present) {
            if (!applied.contains(id)) {
                throw new AssertionError("Expected " + id + " to be applied, applied set is " + applied);
            }
        }
        for (UUID id : absent) {
            if (applied.contains(id)) {
                throw new AssertionError("Expected " + id + " not to be applied, applied set is " + applied);
            }
        }
    }
}
