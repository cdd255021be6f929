package com.cratepilot.app.entity;

/**
 * Where a track's tempo, key and energy came from.
 */
public enum FeatureSource {
    /** Measured values reported by the metadata provider. */
    PROVIDER,
    /** Approximated from genre, popularity and title when the provider withheld audio features. */
    INFERRED,
    /** Entered by hand or loaded from an interchange file. */
    MANUAL
}
