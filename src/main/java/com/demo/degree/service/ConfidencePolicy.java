package com.demo.degree.service;

/**
 * How the authoritative hash match is blended with the fuzzy field score.
 */
public enum ConfidencePolicy {

    /** (hash + fields) / 2. */
    SIMPLE_AVERAGE {
        @Override
        public double combine(double hashScore, double fieldScore) {
            return (hashScore + fieldScore) / 2.0;
        }
    },

    /** 0.7 hash + 0.3 fields; favours the hash match. */
    WEIGHTED {
        @Override
        public double combine(double hashScore, double fieldScore) {
            return hashScore * 0.7 + fieldScore * 0.3;
        }
    };

    public abstract double combine(double hashScore, double fieldScore);
}
