package verifier.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Loads verifier configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code verifier.properties} on the classpath</li>
 *   <li>{@code verifier.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration
 * (e.g., {@code -Dverifier.alert.level=DEBUG}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code verifier.enabled} - true or false</li>
 *   <li>{@code verifier.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code verifier.include.default.exclusions} - true or false</li>
 *   <li>{@code verifier.exclusions.<class name>} - comma separated static field names</li>
 * </ul>
 *
 * @see VerifierConfig
 */
public final class VerifierConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(VerifierConfigLoader.class);

    static final String EXCLUSIONS_PREFIX = "verifier.exclusions.";

    private VerifierConfigLoader() {}

    /**
     * Load from classpath (verifier.properties or verifier.yml).
     * @throws VerifierConfigException if no config file found
     */
    public static VerifierConfig load() {
        InputStream is = getResource("verifier.properties");
        if (is != null) {
            return loadProperties(is, "verifier.properties");
        }

        is = getResource("verifier.yml");
        if (is != null) {
            return loadYaml(is, "verifier.yml");
        }

        throw VerifierConfigException.missing("verifier.properties", "verifier.yml");
    }

    /**
     * Load from classpath, falling back to {@link VerifierConfig#DEFAULTS}
     * (with system property overrides) when no file is present.
     */
    public static VerifierConfig loadOrDefaults() {
        try {
            return load();
        } catch (VerifierConfigException e) {
            if (!e.isMissingConfig()) throw e;
            log.debug("No verifier config file on classpath, using defaults");
            return parse(new Properties());
        }
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws VerifierConfigException if the configuration is invalid
     */
    public static VerifierConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return VerifierConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static VerifierConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new VerifierConfigException("Failed to load", source, e);
        }
    }

    private static VerifierConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new VerifierConfigException("Failed to parse", source, e);
        } catch (IOException e) {
            throw new VerifierConfigException("Failed to load", source, e);
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
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val instanceof Collection<?> list) {
                props.setProperty(key, list.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static VerifierConfig parse(Properties props) {
        VerifierConfig.Builder b = VerifierConfig.builder();

        getBoolean(props, "verifier.enabled").ifPresent(b::enabled);
        getBoolean(props, "verifier.include.default.exclusions").ifPresent(b::includeDefaultExclusions);

        getString(props, "verifier.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        // sorted so that file and system property keys merge deterministically
        TreeSet<String> keys = new TreeSet<>(props.stringPropertyNames());
        keys.addAll(System.getProperties().stringPropertyNames());
        for (String key : keys) {
            if (!key.startsWith(EXCLUSIONS_PREFIX)) continue;
            String className = key.substring(EXCLUSIONS_PREFIX.length());
            if (className.isBlank()) {
                log.warn("Ignoring exclusion without class name: {}", key);
                continue;
            }
            getString(props, key).ifPresent(v -> b.exclude(className, v.split(",")));
        }

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true")) return Optional.of(Boolean.TRUE);
            if (v.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }
}
