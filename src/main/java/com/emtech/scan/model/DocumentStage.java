package com.emtech.scan.model;

/**
 * Coarse progress of a document scan. Pages are processed concurrently, so a document is in the
 * furthest stage reached by any of its pages; stages never move backwards.
 */
public enum DocumentStage {
    INGESTED,
    RASTERIZING,
    RECOGNIZING,
    MERGING,
    MATCHING,
    AGGREGATED,
    REPORTED,
    FAILED;

    public boolean isTerminal() {
        return this == REPORTED || this == FAILED;
    }
}
