package com.emtech.scan.api;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import com.emtech.scan.api.dto.ScanJobResponse;
import com.emtech.scan.api.dto.ScanReportResponse;
import com.emtech.scan.api.dto.ScanRequest;
import com.emtech.scan.model.Document;
import com.emtech.scan.model.ScanReport;
import com.emtech.scan.service.pipeline.ScanJob;
import com.emtech.scan.service.pipeline.ScanJobService;
import com.emtech.scan.service.pipeline.ScanPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Base64;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/v1/scans")
@Tag(name = "Scans", description = "Scan documents for emerging technology terms")
public class ScanController {

    private final ScanPipeline pipeline;
    private final ScanJobService jobs;
    private final ScanTextExporter exporter;
    private final ScanDocxExporter docxExporter;

    public ScanController(ScanPipeline pipeline, ScanJobService jobs, ScanTextExporter exporter,
            ScanDocxExporter docxExporter) {
        this.pipeline = pipeline;
        this.jobs = jobs;
        this.exporter = exporter;
        this.docxExporter = docxExporter;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Scan an uploaded document", description = "Accepts a PDF or image, runs both OCR engines on every page and returns the hits.")
    public ResponseEntity<ScanReportResponse> scanUpload(@RequestPart("document") MultipartFile document) {
        return ResponseEntity.ok(ScanReportResponse.from(pipeline.scan(readUpload(document))));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Scan a base64 encoded document")
    public ResponseEntity<ScanReportResponse> scanBase64(@Valid @RequestBody ScanRequest request) {
        return ResponseEntity.ok(ScanReportResponse.from(pipeline.scan(readBase64(request))));
    }

    @PostMapping(value = "/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Queue a background scan", description = "Returns immediately with a job id that can be polled or cancelled.")
    public ResponseEntity<ScanJobResponse> submitJob(@RequestPart("document") MultipartFile document) {
        ScanJob job = jobs.submit(readUpload(document));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ScanJobResponse.from(job));
    }

    @GetMapping("/jobs/{id}")
    @Operation(summary = "Retrieve the state of a background scan")
    public ResponseEntity<ScanJobResponse> job(@PathVariable("id") long id) {
        return ResponseEntity.ok(ScanJobResponse.from(findJob(id)));
    }

    @DeleteMapping("/jobs/{id}")
    @Operation(summary = "Cancel a background scan", description = "Stops issuing page work; pages not finished within the grace period are reported as failed.")
    public ResponseEntity<ScanJobResponse> cancel(@PathVariable("id") long id) {
        ScanJob job = jobs.cancel(id)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown scan job " + id));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ScanJobResponse.from(job));
    }

    @GetMapping("/jobs/{id}/text")
    @Operation(summary = "Export the recognized text of a finished scan")
    public ResponseEntity<String> text(@PathVariable("id") long id) {
        ScanReport report = finishedReport(findJob(id));
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(exporter.export(report));
    }

    @GetMapping("/jobs/{id}/docx")
    @Operation(summary = "Export the recognized text of a finished scan as a Word document")
    public ResponseEntity<byte[]> docx(@PathVariable("id") long id) {
        ScanJob job = findJob(id);
        ScanReport report = finishedReport(job);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(baseName(job.getDocumentName()) + ".docx")
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(ScanDocxExporter.MEDIA_TYPE))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(docxExporter.export(report));
    }

    private ScanReport finishedReport(ScanJob job) {
        return job.getReport()
                .orElseThrow(() -> new ResponseStatusException(CONFLICT, "Scan job " + job.getId() + " has not finished"));
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "scan";
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private ScanJob findJob(long id) {
        return jobs.find(id)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown scan job " + id));
    }

    private Document readUpload(MultipartFile document) {
        if (document == null || document.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Document file is required");
        }
        try {
            return Document.of(document.getOriginalFilename(), document.getBytes());
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded document", ex);
        }
    }

    private Document readBase64(ScanRequest request) {
        byte[] data;
        try {
            data = Base64.getMimeDecoder().decode(request.contentBase64());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid Base64 document data", ex);
        }
        if (data.length == 0) {
            throw new ResponseStatusException(BAD_REQUEST, "Document data is empty");
        }
        return Document.of(request.fileName(), data);
    }
}
