package com.emtech.scan.model;

import com.emtech.scan.exception.UnsupportedFormatException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Input formats accepted by the rasterizer. The format is inferred from content, never from the
 * file name.
 */
public enum DocumentFormat {
    PDF,
    IMAGE;

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F', '-'};
    private static final int PDF_HEADER_WINDOW = 1024;

    public static DocumentFormat detect(byte[] content) {
        if (content == null || content.length == 0) {
            throw new UnsupportedFormatException("Document is empty");
        }
        if (startsWithPdfHeader(content)) {
            return PDF;
        }
        if (hasImageReader(content)) {
            return IMAGE;
        }
        throw new UnsupportedFormatException("Document is neither a PDF nor a recognized image");
    }

    // PDF readers tolerate leading garbage before the header, so scan a small window.
    private static boolean startsWithPdfHeader(byte[] content) {
        int limit = Math.min(content.length, PDF_HEADER_WINDOW) - PDF_MAGIC.length;
        for (int offset = 0; offset <= limit; offset++) {
            boolean match = true;
            for (int i = 0; i < PDF_MAGIC.length; i++) {
                if (content[offset + i] != PDF_MAGIC[i]) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasImageReader(byte[] content) {
        try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            if (stream == null) {
                return false;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            return readers.hasNext();
        } catch (IOException ex) {
            return false;
        }
    }
}
