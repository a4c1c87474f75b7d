package com.example.Bess_Analytics_Platform.service;

/**
 * Unsupervised outlier scoring over a window of feature vectors.
 *
 * Implementations must be deterministic for identical input and safe to call
 * concurrently.
 */
public interface OutlierScorer {

    /**
     * @param features one row per sample, all rows of equal length
     * @return one score per row; higher means more anomalous
     */
    double[] score(double[][] features);

    /** Short algorithm name for logs and responses. */
    String name();
}
