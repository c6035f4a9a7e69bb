package com.edgesentinel.core.config;

import java.util.List;

/**
 * Thrown when a detector is built from an invalid configuration.
 *
 * <p>
 * Configuration errors are fatal: the detector is never partially built, and
 * the caller must fix the configuration rather than retry.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public DetectorConfigurationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    /**
     * @param subject    what was being validated, e.g. the detector name
     * @param violations every violated constraint; must not be empty
     */
    public DetectorConfigurationException(String subject, List<String> violations) {
        super("Invalid configuration for '" + subject + "': " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return each violated constraint, in the order it was found
     */
    public List<String> getViolations() {
        return violations;
    }
}
