package com.emtech.scan.api.dto;

import com.emtech.scan.model.PageOutcome;
import com.emtech.scan.model.PageStatus;
import io.swagger.v3.oas.annotations.media.Schema;

public record PageResponse(
        @Schema(description = "Zero-based page index") int pageIndex,
        @Schema(description = "MATCHED when the page was processed, FAILED when it could not be") PageStatus status,
        @Schema(description = "Why the page could not be processed") String failureReason,
        @Schema(description = "Fraction of aligned tokens both engines agreed on") double mergeConfidence,
        @Schema(description = "Hits reported for the page") int hitCount,
        @Schema(description = "Candidate hits dropped below the confidence threshold") int suppressedCount) {

    public static PageResponse from(PageOutcome outcome) {
        return new PageResponse(outcome.pageIndex(), outcome.status(), outcome.failureReason(),
                outcome.mergeConfidence(), outcome.hitCount(), outcome.suppressedCount());
    }
}
