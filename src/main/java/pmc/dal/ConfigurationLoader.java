package pmc.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Loads configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots become underscores, upper-cased, or an explicit alias such as CONTROL_POLL_SEC)
 * 3. External config/application.properties (next to JAR or via -Dconfig.dir system property)
 * 4. Classpath application.properties (embedded in JAR)
 *
 * <p>For IDE debugging, specify the external config directory using:</p>
 * <pre>-Dconfig.dir=/path/to/config</pre>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 05/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_FILE = "application.properties";

    // External config locations (relative to JAR)
    private static final String[] EXTERNAL_CONFIG_PATHS = {
            "config/application.properties",
            "../config/application.properties"
    };

    private final Properties properties;
    private final boolean readEnvironment;

    public ConfigurationLoader() {
        this.properties = loadProperties(DEFAULT_CONFIG_FILE);
        this.readEnvironment = true;
    }

    /**
     * Loader backed only by the given properties (no system properties or environment lookup)
     */
    public ConfigurationLoader(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        this.readEnvironment = false;
    }

    private Properties loadProperties(String configFile) {
        Properties props = new Properties();

        Properties externalProps = loadFromExternalLocations();
        if (!externalProps.isEmpty()) {
            props.putAll(externalProps);
            logger.info("Loaded configuration from external file");
        }

        Properties classpathProps = loadFromClasspath(configFile);
        for (String key : classpathProps.stringPropertyNames()) {
            props.putIfAbsent(key, classpathProps.get(key));
        }
        if (!classpathProps.isEmpty()) {
            logger.debug("Loaded default values from classpath '{}'", configFile);
        }

        if (props.isEmpty()) {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private Properties loadFromExternalLocations() {
        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            Path configPath = Paths.get(configDir, DEFAULT_CONFIG_FILE).normalize();
            if (Files.isRegularFile(configPath)) {
                return readFile(configPath);
            }
            logger.warn("Config directory specified but file not found: {}", configPath.toAbsolutePath());
        }

        String jarDir = getJarDirectory();
        logger.debug("Application running from directory: {}", jarDir);

        // Running from target/classes: the bundled file would be picked up as "external"
        if (jarDir.contains("target" + System.getProperty("file.separator") + "classes")) {
            return new Properties();
        }

        for (String relativePath : EXTERNAL_CONFIG_PATHS) {
            Path configPath = Paths.get(jarDir, relativePath).normalize();
            if (Files.isRegularFile(configPath)) {
                Properties props = readFile(configPath);
                if (!props.isEmpty()) {
                    return props;
                }
            } else {
                logger.trace("External config not found at: {}", configPath.toAbsolutePath());
            }
        }
        return new Properties();
    }

    private Properties readFile(Path configPath) {
        Properties props = new Properties();
        try (InputStream input = Files.newInputStream(configPath)) {
            props.load(input);
            logger.info("Loaded external configuration from: {}", configPath.toAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load external config from '{}': {}", configPath, e.getMessage());
        }
        return props;
    }

    private Properties loadFromClasspath(String configFile) {
        Properties props = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (input != null) {
                props.load(input);
            }
        } catch (IOException e) {
            logger.debug("Error loading configuration from classpath '{}': {}", configFile, e.getMessage());
        }
        return props;
    }

    private String getJarDirectory() {
        try {
            String jarPath = getClass()
                    .getProtectionDomain()
                    .getCodeSource()
                    .getLocation()
                    .toURI()
                    .getPath();
            Path path = Paths.get(jarPath);
            if (jarPath.endsWith(".jar")) {
                return path.getParent().toString();
            }
            return path.toString();
        } catch (Exception e) {
            logger.warn("Could not determine JAR directory: {}", e.getMessage());
            return System.getProperty("user.dir");
        }
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        return getString(key, null, defaultValue);
    }

    /**
     * Same as {@link #getString(String, String)} but also checks a legacy environment variable name
     */
    public String getString(String key, String envAlias, String defaultValue) {
        if (readEnvironment) {
            String value = System.getProperty(key);
            if (value != null) {
                logger.debug("Property '{}' from System Properties", key);
                return value;
            }

            String envKey = key.replace('.', '_').toUpperCase();
            value = System.getenv(envKey);
            if (value == null && envAlias != null) {
                envKey = envAlias;
                value = System.getenv(envAlias);
            }
            if (value != null) {
                logger.debug("Property '{}' from Environment Variable '{}'", key, envKey);
                return value;
            }
        }

        String value = properties.getProperty(key);
        if (value != null) {
            return value;
        }
        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        return getInt(key, null, defaultValue);
    }

    public int getInt(String key, String envAlias, int defaultValue) {
        String value = getString(key, envAlias, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return (int) Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Comma separated list, blank entries dropped
     */
    public List<String> getList(String key, String envAlias, String defaultValue) {
        String value = getString(key, envAlias, defaultValue);
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * Path property, a leading "~" is expanded to the user home directory
     */
    public Path getPath(String key, String defaultValue) {
        String value = getString(key, defaultValue);
        if (value.startsWith("~")) {
            value = System.getProperty("user.home") + value.substring(1);
        }
        return Paths.get(value);
    }

    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw ConfigurationException.missing(key);
        }
        return value;
    }
}
