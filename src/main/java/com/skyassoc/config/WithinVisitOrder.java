package com.skyassoc.config;

/**
 * Order in which the sources of one visit are replayed.
 * Visits themselves are always replayed in ascending visit id.
 */
public enum WithinVisitOrder {
    /** Input row order. The caller owns reproducibility. */
    INPUT,
    /** Ascending diaSourceId, independent of how the rows arrived. */
    SOURCE_ID
}
