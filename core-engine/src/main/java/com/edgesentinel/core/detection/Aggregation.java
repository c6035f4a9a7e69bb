package com.edgesentinel.core.detection;

import com.edgesentinel.core.config.DetectorConfigurationException;

import java.util.Locale;

/**
 * Reduction of the edge, source and destination scores into one value.
 *
 * @since 1.0.0
 */
public enum Aggregation {

    MAX {
        @Override
        public double apply(double edge, double src, double dst) {
            return Math.max(edge, Math.max(src, dst));
        }
    },

    MIN {
        @Override
        public double apply(double edge, double src, double dst) {
            return Math.min(edge, Math.min(src, dst));
        }
    },

    MEAN {
        @Override
        public double apply(double edge, double src, double dst) {
            return (edge + src + dst) / 3;
        }
    },

    SUM {
        @Override
        public double apply(double edge, double src, double dst) {
            return edge + src + dst;
        }
    };

    public abstract double apply(double edge, double src, double dst);

    /**
     * @param name aggregation name, case-insensitive
     * @return matching aggregation
     * @throws DetectorConfigurationException if the name is unknown
     */
    public static Aggregation fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (Aggregation aggregation : values()) {
                if (aggregation.name().equals(normalized)) {
                    return aggregation;
                }
            }
        }
        throw new DetectorConfigurationException(
                "Invalid aggregation '" + name + "'. Must be one of [max, mean, min, sum]");
    }
}
