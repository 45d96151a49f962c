package com.emtech.scan.model;

/**
 * Lifecycle of a single page. Statuses only move forward; {@link #FAILED} and {@link #MATCHED}
 * are terminal.
 */
public enum PageStatus {
    PENDING,
    RASTERIZED,
    RECOGNIZED,
    MERGED,
    MATCHED,
    FAILED;

    public boolean isTerminal() {
        return this == MATCHED || this == FAILED;
    }

    public boolean canAdvanceTo(PageStatus next) {
        if (isTerminal() || next == null) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }
}
