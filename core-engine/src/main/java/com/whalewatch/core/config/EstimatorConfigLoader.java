package com.whalewatch.core.config;

import com.whalewatch.core.error.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EstimatorConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods call {@link EstimatorConfig#validate()} after
 * parsing so that a bad range or an empty category list fails at start-up,
 * not in the middle of a query.
 * </p>
 *
 * @since 1.0.0
 */
public final class EstimatorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EstimatorConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "WHALEWATCH_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "whalewatch.yml";

    private EstimatorConfigLoader() {
        // utility class: not instantiable
    }

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code WHALEWATCH_CONFIG_PATH} is set and the file exists, load
     * from there.</li>
     * <li>Otherwise use {@code whalewatch.yml} from the classpath when
     * present.</li>
     * <li>Otherwise fall back to {@link EstimatorConfig#defaults()}.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     */
    public static EstimatorConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Same as {@link #load()} with an explicit override path.
     *
     * @param overridePath file path to prefer; may be {@code null} or blank
     * @return parsed and validated configuration
     */
    public static EstimatorConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath))) {
            LOG.info("Loading estimator config from path: {}", overridePath);
            return fromFile(overridePath);
        }
        if (EstimatorConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading estimator config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No estimator config found, using defaults");
        EstimatorConfig config = EstimatorConfig.defaults();
        config.validate();
        return config;
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException      if the file does not exist
     * @throws IllegalStateException         if reading fails
     * @throws InvalidConfigurationException if the YAML is malformed, names an
     *                                       unknown property or fails
     *                                       validation
     */
    public static EstimatorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static EstimatorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EstimatorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EstimatorConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EstimatorConfig.class, options));
        EstimatorConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Unreadable estimator config: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Estimator config document is empty, using defaults");
            config = EstimatorConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded estimator config: {}", config);
        return config;
    }
}
