package com.emtech.scan.service.ocr;

import com.emtech.scan.exception.EngineUnavailableException;
import com.emtech.scan.model.BoundingBox;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.OcrToken;
import com.emtech.scan.model.Page;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine backed by Tesseract through Tess4J. Reports word-level bounding boxes and confidences.
 * A fresh {@link ITesseract} is obtained per call because a Tess4J instance keeps its native
 * handle in fields and cannot be shared between threads.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final String id;
    private final Supplier<ITesseract> tesseractFactory;
    private final boolean available;

    public TesseractOcrEngine(String id, Supplier<ITesseract> tesseractFactory, boolean available) {
        this.id = Objects.requireNonNull(id, "id");
        this.tesseractFactory = Objects.requireNonNull(tesseractFactory, "tesseractFactory");
        this.available = available;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public OcrResult recognize(Page page) {
        if (!available) {
            throw new EngineUnavailableException(id, page.index(),
                    "Tesseract language data is not configured; engine " + id + " cannot run");
        }
        BufferedImage image = page.bitmap()
                .orElseThrow(() -> new IllegalStateException("Page " + page.index() + " has no bitmap"));
        ITesseract tesseract = tesseractFactory.get();
        try {
            // one recognition pass; the page text is rebuilt from the words
            List<Word> words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            List<OcrToken> tokens = toTokens(words);
            if (tokens.isEmpty()) {
                log.debug("Tesseract recognized no text on page {}", page.index());
                return OcrResult.empty(id, page.index());
            }
            String text = tokens.stream().map(OcrToken::text).collect(Collectors.joining(" "));
            log.debug("Tesseract recognized {} words on page {}", tokens.size(), page.index());
            return new OcrResult(id, page.index(), text, tokens);
        } catch (LinkageError ex) {
            throw new EngineUnavailableException(id, page.index(),
                    "Tesseract native library could not be loaded: " + ex.getMessage(), ex);
        } catch (Error ex) {
            if ("Invalid memory access".equalsIgnoreCase(ex.getMessage())) {
                throw new EngineUnavailableException(id, page.index(),
                        "Tesseract native layer failed; verify the tessdata directory contents", ex);
            }
            throw ex;
        }
    }

    private List<OcrToken> toTokens(List<Word> words) {
        List<OcrToken> tokens = new ArrayList<>();
        if (words == null) {
            return tokens;
        }
        for (Word word : words) {
            String text = word.getText();
            if (text == null) {
                continue;
            }
            BoundingBox region = toRegion(word.getBoundingBox());
            Double confidence = toConfidence(word.getConfidence());
            for (String part : text.trim().split("\\s+")) {
                if (!part.isBlank()) {
                    tokens.add(new OcrToken(part, region, confidence));
                }
            }
        }
        return tokens;
    }

    private static BoundingBox toRegion(Rectangle rectangle) {
        if (rectangle == null) {
            return null;
        }
        return new BoundingBox(rectangle.x, rectangle.y, Math.max(0, rectangle.width), Math.max(0, rectangle.height));
    }

    static Double toConfidence(float raw) {
        if (raw < 0 || !Float.isFinite(raw)) {
            return null;
        }
        return Math.max(0.0, Math.min(1.0, raw / 100.0));
    }
}
