/**
 * Domain model classes for Edge Sentinel.
 *
 * <p>
 * This package contains the data transfer objects shared between the
 * detection engine and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.edgesentinel.core.model.FlowRecord} - one directed flow
 * observation</li>
 * <li>{@link com.edgesentinel.core.model.Alert} - burst alert emitted by a
 * monitor</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.edgesentinel.core.model;
