package com.flowmable.handwriting;

/**
 * Algorithm fidelity used to pick a variant for each estimator and for synthesis.
 */
public enum Fidelity {
    /** Global thresholds, means, median-cut ink colour, unweighted slant. */
    BASIC,
    /** Adaptive thresholds, medians, running-mean ink clustering, vote-weighted slant. */
    ENHANCED
}
