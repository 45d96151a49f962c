package com.emtech.scan.api;

import com.emtech.scan.model.PageOutcome;
import com.emtech.scan.model.ScanReport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

/**
 * Word counterpart of {@link ScanTextExporter}: a bold heading per page followed by one paragraph
 * holding the canonical text, or the failure reason for pages that could not be processed.
 */
@Component
public class ScanDocxExporter {

    public static final String MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    public byte[] export(ScanReport report) {
        try (XWPFDocument document = new XWPFDocument();
                ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XWPFRun title = document.createParagraph().createRun();
            title.setBold(true);
            title.setText("Document: " + report.documentName() + " (" + report.documentId() + ")");
            paragraph(document, "Status: " + report.status(), false);
            if (report.failureReason() != null) {
                paragraph(document, "Reason: " + report.failureReason(), false);
            }
            for (PageOutcome page : report.pages()) {
                XWPFRun heading = document.createParagraph().createRun();
                heading.setBold(true);
                heading.setText("Page " + (page.pageIndex() + 1));
                if (page.isFailed()) {
                    paragraph(document, "[not processed: " + page.failureReason() + "]", true);
                } else {
                    paragraph(document, page.text() == null ? "" : page.text(), false);
                }
            }
            document.write(out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write Word export for document " + report.documentId(), ex);
        }
    }

    private static void paragraph(XWPFDocument document, String text, boolean italic) {
        XWPFParagraph paragraph = document.createParagraph();
        XWPFRun run = paragraph.createRun();
        run.setItalic(italic);
        run.setText(text);
    }
}
