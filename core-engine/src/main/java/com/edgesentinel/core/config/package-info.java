/**
 * Configuration loading and validation for Edge Sentinel detectors.
 *
 * <p>
 * A detector is described in YAML and loaded by
 * {@link com.edgesentinel.core.config.DetectorConfigLoader} into a
 * {@link com.edgesentinel.core.config.DetectorConfig} instance. Validation
 * runs automatically after parsing; violations surface as a
 * {@link com.edgesentinel.core.config.DetectorConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.edgesentinel.core.config;
