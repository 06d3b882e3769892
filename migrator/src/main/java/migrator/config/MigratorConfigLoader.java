package migrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migrator configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migrator.properties} on the classpath</li>
 *   <li>{@code migrator.yml} on the classpath</li>
 * </ol>
 * If neither exists, {@link MigratorConfig#DEFAULTS} is used.
 *
 * <p>System properties override file-based configuration, using the same
 * names (e.g., {@code -Dmigrator.alert.level=DEBUG}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migrator.metadata.table} - table adapters record applied ids in</li>
 *   <li>{@code migrator.history.size} - number of run history entries</li>
 *   <li>{@code migrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigratorConfig
 */
public final class MigratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigratorConfigLoader.class);

    private MigratorConfigLoader() {}

    /**
     * Load from classpath (migrator.properties or migrator.yml), falling back to defaults.
     *
     * @return the loaded configuration
     * @throws MigrationConfigException if a config file exists but cannot be parsed
     */
    public static MigratorConfig load() {
        InputStream is = getResource("migrator.properties");
        if (is != null) {
            return loadProperties(is, "migrator.properties");
        }

        is = getResource("migrator.yml");
        if (is != null) {
            return loadYaml(is, "migrator.yml");
        }

        log.debug("No migrator.properties or migrator.yml on classpath, using defaults");
        return parse(new Properties());
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    /**
     * Loads configuration from an external file path.
     *
     * @param path path to the configuration file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static MigratorConfig loadFromFile(String path) throws IOException {
        return loadFromFile(Path.of(path));
    }

    private static InputStream getResource(String name) {
        return MigratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigratorConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigratorConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException | YAMLException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static MigratorConfig parse(Properties props) {
        MigratorConfig.Builder b = MigratorConfig.builder();

        getString(props, "migrator.metadata.table").ifPresent(v -> {
            try {
                b.metadataTable(v);
            } catch (MigrationConfigException e) {
                log.warn("Invalid metadata.table: {}", v);
            }
        });

        getInt(props, "migrator.history.size").ifPresent(v -> {
            if (v > 0) b.historySize(v);
            else log.warn("Invalid history.size: {}", v);
        });

        getString(props, "migrator.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
