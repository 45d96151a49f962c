package com.emtech.scan.service.raster;

import com.emtech.scan.exception.CorruptDocumentException;
import com.emtech.scan.model.Document;
import com.emtech.scan.model.Page;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily rasterizes the pages of one document. Every rendered page is also written as a PNG into
 * a private working directory so that engines running as external processes can read it. The
 * directory and the parsed source are released by {@link #close()} on every exit path.
 *
 * <p>A page that cannot be extracted is yielded with status {@code FAILED}; iteration continues
 * with the following pages.</p>
 */
public abstract class RasterSession implements AutoCloseable, Iterable<Page> {

    private static final Logger log = LoggerFactory.getLogger(RasterSession.class);

    private final Document document;
    private final Path workDir;
    private final PageImagePreprocessor preprocessor;
    private final int maxPages;
    private int failedPages;
    private boolean closed;

    protected RasterSession(Document document, Path workDir, PageImagePreprocessor preprocessor, int maxPages) {
        this.document = document;
        this.workDir = workDir;
        this.preprocessor = preprocessor;
        this.maxPages = maxPages;
    }

    protected abstract int sourcePageCount();

    protected abstract BufferedImage render(int pageIndex) throws IOException;

    protected abstract void closeSource() throws IOException;

    public Document document() {
        return document;
    }

    public int pageCount() {
        int count = sourcePageCount();
        return maxPages > 0 ? Math.min(count, maxPages) : count;
    }

    public synchronized int failedPages() {
        return failedPages;
    }

    @Override
    public Iterator<Page> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < pageCount();
            }

            @Override
            public Page next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return extract(next++);
            }
        };
    }

    Page extract(int pageIndex) {
        if (closed) {
            throw new IllegalStateException("Raster session for " + document.id() + " is closed");
        }
        try {
            BufferedImage bitmap = render(pageIndex);
            if (bitmap == null) {
                throw new IOException("renderer returned no image");
            }
            if (preprocessor != null) {
                bitmap = preprocessor.normalize(bitmap);
            }
            Path imageFile = workDir.resolve(String.format("page-%05d.png", pageIndex));
            ImageIO.write(bitmap, "png", imageFile.toFile());
            log.debug("Rasterized page {} of {} ({}x{})", pageIndex, document.id(), bitmap.getWidth(), bitmap.getHeight());
            return Page.rasterized(document.id(), pageIndex, bitmap, imageFile);
        } catch (IOException | RuntimeException ex) {
            CorruptDocumentException failure = new CorruptDocumentException(pageIndex,
                    "Page " + pageIndex + " could not be extracted: " + ex.getMessage(), ex);
            log.warn("Corrupt page in {}: {}", document.id(), failure.getMessage());
            synchronized (this) {
                failedPages++;
            }
            return Page.failed(document.id(), pageIndex, failure.getMessage());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            closeSource();
        } catch (IOException ex) {
            log.warn("Unable to close source of {}: {}", document.id(), ex.getMessage());
        }
        deleteWorkDir();
    }

    private void deleteWorkDir() {
        if (workDir == null || !Files.exists(workDir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        } catch (IOException | UncheckedIOException ex) {
            log.warn("Unable to delete raster working directory {}: {}", workDir, ex.getMessage());
        }
    }
}
