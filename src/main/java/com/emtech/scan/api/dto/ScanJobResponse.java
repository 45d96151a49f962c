package com.emtech.scan.api.dto;

import com.emtech.scan.model.DocumentStage;
import com.emtech.scan.service.pipeline.ScanJob;
import com.emtech.scan.service.pipeline.ScanJobState;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "State of a background scan")
public record ScanJobResponse(
        long id,
        String documentId,
        String documentName,
        ScanJobState state,
        DocumentStage stage,
        @Schema(description = "Pages in the document, once known") int totalPages,
        @Schema(description = "Pages finished so far, successfully or not") int finishedPages,
        boolean cancelRequested,
        Instant createdAt,
        Instant finishedAt,
        @Schema(description = "Present once the job has finished") ScanReportResponse report) {

    public static ScanJobResponse from(ScanJob job) {
        return new ScanJobResponse(
                job.getId(),
                job.getDocumentId(),
                job.getDocumentName(),
                job.getState(),
                job.getControl().stage(),
                job.getControl().totalPages(),
                job.getControl().finishedPages(),
                job.getControl().isCancelled(),
                job.getCreatedAt(),
                job.getFinishedAt().orElse(null),
                job.getReport().map(ScanReportResponse::from).orElse(null));
    }
}
