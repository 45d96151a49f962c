package com.emtech.scan.api.dto;

import com.emtech.scan.model.Hit;
import com.emtech.scan.model.ScanReport;
import com.emtech.scan.model.ScanStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Map;

@Schema(description = "Result of scanning one document")
public record ScanReportResponse(
        String documentId,
        String documentName,
        ScanStatus status,
        @Schema(description = "Why the scan failed or stopped early") String failureReason,
        int totalPages,
        @Schema(description = "Indexes of pages that could not be processed; absence of hits on other pages is a real negative")
        List<Integer> failedPages,
        @Schema(description = "Hit count per category") Map<String, Long> categoryCounts,
        @Schema(description = "Hits ordered by page, then confidence descending") List<Hit> hits,
        List<PageResponse> pages) {

    public static ScanReportResponse from(ScanReport report) {
        return new ScanReportResponse(
                report.documentId(),
                report.documentName(),
                report.status(),
                report.failureReason(),
                report.totalPages(),
                report.failedPages().stream().map(page -> page.pageIndex()).toList(),
                report.categoryCounts(),
                report.hits(),
                report.pages().stream().map(PageResponse::from).toList());
    }
}
