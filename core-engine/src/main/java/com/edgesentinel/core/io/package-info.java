/**
 * Readers that turn external tables into
 * {@link com.edgesentinel.core.model.FlowRecord} streams.
 *
 * @since 1.0.0
 */
package com.edgesentinel.core.io;
