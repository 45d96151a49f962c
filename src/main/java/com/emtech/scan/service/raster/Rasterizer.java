package com.emtech.scan.service.raster;

import com.emtech.scan.config.ScanProperties;
import com.emtech.scan.config.ScanProperties.RasterProperties;
import com.emtech.scan.exception.ScanException;
import com.emtech.scan.model.Document;
import com.emtech.scan.model.DocumentFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a document into a lazy sequence of page bitmaps. The format is inferred from content.
 */
@Component
public class Rasterizer {

    private static final Logger log = LoggerFactory.getLogger(Rasterizer.class);

    private final RasterProperties properties;
    private final PageImagePreprocessor preprocessor;

    @Autowired
    public Rasterizer(ScanProperties properties, PageImagePreprocessor preprocessor) {
        this(properties.raster(), preprocessor);
    }

    Rasterizer(RasterProperties properties, PageImagePreprocessor preprocessor) {
        this.properties = properties;
        this.preprocessor = properties.preprocess() ? preprocessor : null;
    }

    /**
     * Opens a raster session for the document. The caller owns the session and must close it.
     *
     * @throws com.emtech.scan.exception.UnsupportedFormatException when the content is neither a
     *         recognized image nor a parseable PDF
     */
    public RasterSession open(Document document) {
        DocumentFormat format = DocumentFormat.detect(document.content());
        Path workDir = createWorkDir(document);
        try {
            RasterSession session = switch (format) {
                case PDF -> new PdfRasterSession(document, workDir, preprocessor, properties.maxPages(), properties.dpi());
                case IMAGE -> new ImageRasterSession(document, workDir, preprocessor, properties.maxPages());
            };
            log.info("Opened {} document {} ({}) with {} page(s) at {} dpi",
                    format, document.id(), document.name(), session.pageCount(), properties.dpi());
            return session;
        } catch (RuntimeException ex) {
            deleteQuietly(workDir);
            throw ex;
        }
    }

    private Path createWorkDir(Document document) {
        try {
            return Files.createTempDirectory(properties.tempPrefix());
        } catch (IOException ex) {
            throw new ScanException("Unable to allocate temporary page storage for " + document.id(), ex);
        }
    }

    private static void deleteQuietly(Path directory) {
        try {
            Files.deleteIfExists(directory);
        } catch (IOException ex) {
            log.debug("Unable to delete raster working directory {}: {}", directory, ex.getMessage());
        }
    }
}
