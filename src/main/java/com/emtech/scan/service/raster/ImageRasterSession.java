package com.emtech.scan.service.raster;

import com.emtech.scan.exception.UnsupportedFormatException;
import com.emtech.scan.model.Document;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Treats a raster image as a document. Multi-frame formats such as TIFF yield one page per frame.
 */
class ImageRasterSession extends RasterSession {

    private static final Logger log = LoggerFactory.getLogger(ImageRasterSession.class);

    private final ImageInputStream stream;
    private final ImageReader reader;
    private final int frames;

    ImageRasterSession(Document document, Path workDir, PageImagePreprocessor preprocessor, int maxPages) {
        super(document, workDir, preprocessor, maxPages);
        ImageInputStream input = null;
        ImageReader imageReader = null;
        try {
            input = ImageIO.createImageInputStream(new ByteArrayInputStream(document.content()));
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new UnsupportedFormatException("No image reader accepts document " + document.id());
            }
            imageReader = readers.next();
            imageReader.setInput(input, false, true);
            int count = imageReader.getNumImages(true);
            if (count <= 0) {
                throw new UnsupportedFormatException("Image document " + document.id() + " contains no frames");
            }
            this.stream = input;
            this.reader = imageReader;
            this.frames = count;
        } catch (IOException ex) {
            dispose(imageReader, input);
            throw new UnsupportedFormatException("Document " + document.id() + " is not a readable image: "
                    + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            dispose(imageReader, input);
            throw ex;
        }
    }

    @Override
    protected int sourcePageCount() {
        return frames;
    }

    @Override
    protected BufferedImage render(int pageIndex) throws IOException {
        return reader.read(pageIndex);
    }

    @Override
    protected void closeSource() throws IOException {
        dispose(reader, stream);
    }

    private static void dispose(ImageReader reader, ImageInputStream input) {
        if (reader != null) {
            reader.dispose();
        }
        if (input != null) {
            try {
                input.close();
            } catch (IOException ex) {
                log.debug("Unable to close image stream: {}", ex.getMessage());
            }
        }
    }
}
