package com.edgesentinel.core.detection;

import com.edgesentinel.core.config.DetectorConfig;
import com.edgesentinel.core.config.DetectorConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Factory that creates {@link Monitor} instances from
 * {@link DetectorConfig} configurations.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * register the type name in {@link #REGISTRY} next to the constructor that
 * builds it.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private static final Map<String, Function<DetectorConfig, Monitor>> REGISTRY = registry();

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a monitor for the given configuration. The monitor is
     * initialized before it is returned.
     *
     * @param config the detector configuration; must not be {@code null}
     * @return a ready-to-use {@link Monitor}
     * @throws NullPointerException           if {@code config} is {@code null}
     * @throws DetectorConfigurationException if the type is unknown or the
     *                                        configuration is invalid
     */
    public static Monitor create(DetectorConfig config) {
        Monitor monitor = createUninitialized(config);
        monitor.initialize();
        return monitor;
    }

    /**
     * Create a monitor without calling {@link Monitor#initialize()}.
     *
     * @param config the detector configuration; must not be {@code null}
     * @return the monitor
     * @throws DetectorConfigurationException if the type is unknown or the
     *                                        configuration is invalid
     */
    public static Monitor createUninitialized(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        String type = config.getType() == null ? null : config.getType().toLowerCase(Locale.ROOT);
        Function<DetectorConfig, Monitor> constructor = type == null ? null : REGISTRY.get(type);
        if (constructor == null) {
            throw new DetectorConfigurationException(
                    "Unknown detector type: '" + config.getType()
                            + "'. Supported types: " + String.join(", ", REGISTRY.keySet()));
        }
        LOG.info("Creating {} monitor '{}'", type, config.getName());
        return constructor.apply(config);
    }

    /**
     * @return registered detector type names
     */
    public static Set<String> supportedTypes() {
        return REGISTRY.keySet();
    }

    private static Map<String, Function<DetectorConfig, Monitor>> registry() {
        Map<String, Function<DetectorConfig, Monitor>> registry = new LinkedHashMap<>();
        registry.put(MidasR.TYPE, MidasR::new);
        registry.put(ShardedMonitor.TYPE, ShardedMonitor::new);
        return Collections.unmodifiableMap(registry);
    }
}
