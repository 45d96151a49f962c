package com.emtech.scan.api;

import com.emtech.scan.api.dto.EngineStatusResponse;
import com.emtech.scan.model.TermDefinition;
import com.emtech.scan.service.matching.TermCatalog;
import com.emtech.scan.service.ocr.OcrEngine;
import com.emtech.scan.service.ocr.OcrEnginePair;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/catalog")
@Tag(name = "Catalog", description = "Configured terms and OCR engines")
public class CatalogController {

    private final TermCatalog catalog;
    private final OcrEnginePair engines;

    public CatalogController(TermCatalog catalog, OcrEnginePair engines) {
        this.catalog = catalog;
        this.engines = engines;
    }

    @GetMapping("/terms")
    @Operation(summary = "List the technology terms scans look for")
    public ResponseEntity<List<TermDefinition>> terms() {
        return ResponseEntity.ok(catalog.definitions());
    }

    @GetMapping("/engines")
    @Operation(summary = "Report which OCR engines are configured and can be invoked")
    public ResponseEntity<List<EngineStatusResponse>> engines() {
        List<EngineStatusResponse> statuses = engines.engines().stream()
                .map(this::toStatus)
                .toList();
        return ResponseEntity.ok(statuses);
    }

    private EngineStatusResponse toStatus(OcrEngine engine) {
        return new EngineStatusResponse(engine.id(), engine.id().equals(engines.primaryId()), engine.isAvailable());
    }
}
