package migrator.scanner;

import migrator.Migration;
import migrator.annotations.SchemaMigration;
import migrator.exceptions.MigrationDiscoveryException;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers {@link SchemaMigration}-annotated classes in the given packages
 * and instantiates them.
 *
 * <p>Every annotated class found must
 * <ul>
 *   <li>be a concrete class assignable to the requested migration type</li>
 *   <li>have a no-argument constructor</li>
 * </ul>
 * otherwise discovery fails with a {@link MigrationDiscoveryException}.
 *
 * <p>The returned list is sorted by class name so repeated scans of the same
 * classpath register migrations in the same order.
 *
 * <h2>Usage:</h2>
 * <pre>
 * List&lt;JdbcMigration&gt; found = MigrationScanner.discover(JdbcMigration.class, "com.acme.schema");
 * migrator.registerMultiple(found);
 * </pre>
 */
public final class MigrationScanner {

    private static final Logger log = LoggerFactory.getLogger(MigrationScanner.class);

    private MigrationScanner() {
    }

    /**
     * Discovers migrations using the context classloader.
     *
     * @param type the migration type every discovered class must implement
     * @param packages package prefixes to scan
     * @return instantiated migrations sorted by class name
     * @throws MigrationDiscoveryException if an annotated class cannot be used
     */
    public static <M extends Migration> List<M> discover(Class<M> type, String... packages) {
        return discover(null, type, packages);
    }

    /**
     * Discovers migrations using a specific classloader.
     *
     * @param classLoader the classloader to scan, or null for the context classloader
     * @param type the migration type every discovered class must implement
     * @param packages package prefixes to scan (at least one)
     * @return instantiated migrations sorted by class name
     * @throws MigrationDiscoveryException if an annotated class cannot be used
     */
    public static <M extends Migration> List<M> discover(ClassLoader classLoader, Class<M> type, String... packages) {
        if (packages == null || packages.length == 0) {
            throw new IllegalArgumentException("At least one package to scan is required");
        }

        ConfigurationBuilder config = new ConfigurationBuilder()
                .addScanners(Scanners.TypesAnnotated, Scanners.SubTypes);

        Set<URL> urls = new LinkedHashSet<>();
        FilterBuilder filter = new FilterBuilder();
        for (String pkg : packages) {
            urls.addAll(classLoader != null
                    ? ClasspathHelper.forPackage(pkg, classLoader)
                    : ClasspathHelper.forPackage(pkg));
            filter.includePackage(pkg);
        }
        if (urls.isEmpty()) {
            log.debug("No classpath location contains {}", List.of(packages));
            return List.of();
        }
        config.setUrls(urls);
        config.filterInputsBy(filter);
        if (classLoader != null) {
            config.addClassLoaders(classLoader);
        }

        Reflections reflections = new Reflections(config);
        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(SchemaMigration.class);

        List<Class<?>> sorted = new ArrayList<>(annotated);
        sorted.sort(Comparator.comparing(Class::getName));

        List<M> result = new ArrayList<>(sorted.size());
        for (Class<?> cls : sorted) {
            result.add(instantiate(cls, type));
        }

        log.debug("Discovered {} migration(s) in {}", result.size(), List.of(packages));
        return result;
    }

    private static <M extends Migration> M instantiate(Class<?> cls, Class<M> type) {
        if (!type.isAssignableFrom(cls)) {
            throw new MigrationDiscoveryException(
                    "@SchemaMigration class " + cls.getName() + " does not implement " + type.getName());
        }
        if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers())) {
            throw new MigrationDiscoveryException(
                    "@SchemaMigration class " + cls.getName() + " is not a concrete class");
        }

        try {
            Constructor<?> ctor = cls.getDeclaredConstructor();
            ctor.setAccessible(true);
            return type.cast(ctor.newInstance());
        } catch (NoSuchMethodException e) {
            throw new MigrationDiscoveryException(
                    "@SchemaMigration class " + cls.getName() + " has no no-argument constructor", e);
        } catch (InvocationTargetException e) {
            throw new MigrationDiscoveryException(
                    "Constructor of " + cls.getName() + " failed", e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new MigrationDiscoveryException("Cannot instantiate " + cls.getName(), e);
        }
    }
}
