package com.emtech.scan.service.pipeline;

import com.emtech.scan.model.ScanReport;
import java.time.Instant;
import java.util.Optional;

/**
 * A scan submitted for background execution.
 */
public class ScanJob {

    private final long id;
    private final String documentId;
    private final String documentName;
    private final ScanControl control;
    private final Instant createdAt;
    private volatile ScanJobState state;
    private volatile ScanReport report;
    private volatile Instant finishedAt;

    public ScanJob(long id, String documentId, String documentName) {
        this.id = id;
        this.documentId = documentId;
        this.documentName = documentName;
        this.control = new ScanControl();
        this.createdAt = Instant.now();
        this.state = ScanJobState.QUEUED;
    }

    public long getId() {
        return id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getDocumentName() {
        return documentName;
    }

    public ScanControl getControl() {
        return control;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ScanJobState getState() {
        return state;
    }

    public Optional<ScanReport> getReport() {
        return Optional.ofNullable(report);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    synchronized boolean start() {
        if (state != ScanJobState.QUEUED) {
            return false;
        }
        state = ScanJobState.RUNNING;
        return true;
    }

    synchronized void finish(ScanReport report) {
        this.report = report;
        this.state = switch (report.status()) {
            case COMPLETED -> ScanJobState.COMPLETED;
            case CANCELLED -> ScanJobState.CANCELLED;
            case FAILED -> control.isCancelled() ? ScanJobState.CANCELLED : ScanJobState.FAILED;
        };
        this.finishedAt = Instant.now();
    }

    /**
     * Cancels a job that has not started yet. Running jobs finish through {@link #finish}.
     */
    synchronized boolean cancelIfQueued() {
        if (state != ScanJobState.QUEUED) {
            return false;
        }
        state = ScanJobState.CANCELLED;
        finishedAt = Instant.now();
        return true;
    }
}
