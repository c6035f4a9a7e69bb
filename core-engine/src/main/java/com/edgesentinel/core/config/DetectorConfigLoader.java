package com.edgesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link DetectorConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods call {@link DetectorConfig#validate()} after
 * parsing so that the application fails fast on an invalid detector.
 * An empty document yields {@link DetectorConfig#defaults()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DETECTOR_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "detector.yml";

    private DetectorConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the detector configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws DetectorConfigurationException if validation fails
     */
    public static DetectorConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detector config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading detector config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the detector configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException       if the file does not exist
     * @throws IllegalStateException          if reading fails
     * @throws DetectorConfigurationException if validation fails
     */
    public static DetectorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Detector config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detector config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detector config file: " + path, e);
        }
    }

    /**
     * Load the detector configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException       if the resource does not exist
     * @throws IllegalStateException          if reading fails
     * @throws DetectorConfigurationException if validation fails
     */
    public static DetectorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static DetectorConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorConfig.class, options));
        DetectorConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Detector config is empty, using defaults");
            config = DetectorConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded detector config: {}", config);
        return config;
    }
}
