package com.emtech.scan.service.raster;

import com.emtech.scan.exception.UnsupportedFormatException;
import com.emtech.scan.model.Document;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/**
 * Renders PDF pages with PDFBox at a fixed resolution.
 */
class PdfRasterSession extends RasterSession {

    private final PDDocument pdf;
    private final PDFRenderer renderer;
    private final int dpi;

    PdfRasterSession(Document document, Path workDir, PageImagePreprocessor preprocessor, int maxPages, int dpi) {
        super(document, workDir, preprocessor, maxPages);
        this.dpi = dpi;
        try {
            this.pdf = Loader.loadPDF(document.content());
        } catch (IOException ex) {
            throw new UnsupportedFormatException("Document " + document.id() + " is not a parseable PDF: "
                    + ex.getMessage(), ex);
        }
        this.renderer = new PDFRenderer(pdf);
        this.renderer.setSubsamplingAllowed(false);
    }

    @Override
    protected int sourcePageCount() {
        return pdf.getNumberOfPages();
    }

    @Override
    protected BufferedImage render(int pageIndex) throws IOException {
        return renderer.renderImageWithDPI(pageIndex, dpi, ImageType.GRAY);
    }

    @Override
    protected void closeSource() throws IOException {
        pdf.close();
    }
}
