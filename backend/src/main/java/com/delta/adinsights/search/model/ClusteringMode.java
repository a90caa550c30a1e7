package com.delta.adinsights.search.model;

/**
 * Where cross-domain keyphrase clusters come from.
 */
public enum ClusteringMode {
    /** The provider clusters each domain on its own; clusters are merged locally. */
    PER_DOMAIN,
    /** The provider clusters all domains in one batch call; clusters pass through unchanged. */
    UNIFIED
}
