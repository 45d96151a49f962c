package com.emtech.scan.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Processing result of one page")
public record PageOutcome(
        @Schema(description = "Zero-based page index") int pageIndex,
        @Schema(description = "Final page status; FAILED means the page could not be processed") PageStatus status,
        @Schema(description = "Why the page failed, if it did") String failureReason,
        @Schema(description = "Fraction of aligned tokens on which both engines agreed") double mergeConfidence,
        @Schema(description = "Number of hits recorded for the page") int hitCount,
        @Schema(description = "Number of hits suppressed below the confidence threshold") int suppressedCount,
        @Schema(description = "Canonical text of the page, absent for failed pages") String text) {

    public static PageOutcome failed(int pageIndex, String reason) {
        return new PageOutcome(pageIndex, PageStatus.FAILED, reason, 0.0, 0, 0, null);
    }

    public boolean isFailed() {
        return status == PageStatus.FAILED;
    }
}
