package com.emtech.scan.api;

import com.emtech.scan.model.PageOutcome;
import com.emtech.scan.model.ScanReport;
import org.springframework.stereotype.Component;

/**
 * Renders the canonical text of every page of a finished scan as plain text, one section per
 * page. Failed pages are listed with their reason so an empty section is never mistaken for a
 * blank page.
 */
@Component
public class ScanTextExporter {

    public String export(ScanReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Document: ").append(report.documentName()).append(" (").append(report.documentId()).append(")\n");
        out.append("Status: ").append(report.status()).append('\n');
        if (report.failureReason() != null) {
            out.append("Reason: ").append(report.failureReason()).append('\n');
        }
        for (PageOutcome page : report.pages()) {
            out.append('\n').append("--- page ").append(page.pageIndex() + 1).append(" ---\n");
            if (page.isFailed()) {
                out.append("[not processed: ").append(page.failureReason()).append("]\n");
            } else if (page.text() != null && !page.text().isEmpty()) {
                out.append(page.text()).append('\n');
            }
        }
        return out.toString();
    }
}
