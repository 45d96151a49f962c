package com.emtech.scan.service.raster;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import javax.imageio.ImageIO;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.RotatedRect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes a page bitmap before OCR: grayscale conversion, a 3x3 Gaussian blur to suppress scan
 * noise, Otsu binarisation and deskewing based on the minimum-area rectangle enclosing the ink.
 */
@Component
public class PageImagePreprocessor {

    private static final Logger log = LoggerFactory.getLogger(PageImagePreprocessor.class);

    private static final double MIN_SKEW_DEGREES = 0.3;
    private static final double MAX_SKEW_DEGREES = 20.0;
    private static final int MIN_INK_PIXELS = 50;

    public BufferedImage normalize(BufferedImage page) {
        if (page == null) {
            throw new IllegalArgumentException("Page image cannot be null");
        }
        Mat gray = decodeGray(page);
        Mat blurred = new Mat();
        opencv_imgproc.GaussianBlur(gray, blurred, new Size(3, 3), 0);

        Mat binary = new Mat();
        opencv_imgproc.threshold(blurred, binary, 0, 255, opencv_imgproc.THRESH_BINARY | opencv_imgproc.THRESH_OTSU);

        double angle = skewAngle(binary);
        if (Math.abs(angle) < MIN_SKEW_DEGREES || Math.abs(angle) > MAX_SKEW_DEGREES) {
            return encode(binary);
        }
        log.debug("Deskewing page by {} degrees", angle);
        return encode(rotate(binary, angle));
    }

    /**
     * Estimates the page rotation in degrees from the dark pixels of a binarised page. Returns zero
     * when there is too little ink to judge.
     */
    double skewAngle(Mat binary) {
        Mat ink = new Mat();
        opencv_core.bitwise_not(binary, ink);
        Mat points = new Mat();
        opencv_core.findNonZero(ink, points);
        if (points.empty() || points.rows() < MIN_INK_PIXELS) {
            return 0.0;
        }
        RotatedRect box = opencv_imgproc.minAreaRect(points);
        double angle = box.angle();
        // OpenCV reports (0, 90]; fold into (-45, 45].
        if (angle > 45) {
            angle -= 90;
        } else if (angle < -45) {
            angle += 90;
        }
        return angle;
    }

    private Mat rotate(Mat binary, double angle) {
        Point2f center = new Point2f(binary.cols() / 2f, binary.rows() / 2f);
        Mat rotation = opencv_imgproc.getRotationMatrix2D(center, angle, 1.0);
        Mat rotated = new Mat();
        opencv_imgproc.warpAffine(binary, rotated, rotation, binary.size(),
                opencv_imgproc.INTER_CUBIC, opencv_core.BORDER_REPLICATE, new Scalar());
        return rotated;
    }

    Mat decodeGray(BufferedImage image) {
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", output)) {
                throw new IllegalStateException("No PNG writer available");
            }
            Mat decoded = opencv_imgcodecs.imdecode(new Mat(output.toByteArray()), opencv_imgcodecs.IMREAD_GRAYSCALE);
            if (decoded == null || decoded.empty()) {
                throw new IllegalStateException("Unable to decode page bitmap");
            }
            return decoded;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to encode page bitmap", ex);
        }
    }

    private BufferedImage encode(Mat mat) {
        try (BytePointer buffer = new BytePointer()) {
            boolean encoded = opencv_imgcodecs.imencode(".png", mat, buffer);
            if (!encoded) {
                throw new IllegalStateException("Failed to encode image as PNG");
            }
            byte[] bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new IllegalStateException("Unable to read normalized page bitmap");
            }
            return image;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to decode normalized page bitmap", ex);
        }
    }
}
