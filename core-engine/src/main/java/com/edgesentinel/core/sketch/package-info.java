/**
 * Approximate frequency counting.
 *
 * <p>
 * {@link com.edgesentinel.core.sketch.CountMinSketch} holds decayable
 * real-valued counters indexed by
 * {@link com.edgesentinel.core.sketch.SketchKey}, whose tagged encoding keeps
 * edge and node keys in disjoint key spaces.
 * </p>
 *
 * @since 1.0.0
 */
package com.edgesentinel.core.sketch;
