package com.emtech.scan.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.Page;
import org.junit.jupiter.api.Test;

class OcrEnginePairTest {

    private static OcrEngine engine(String id) {
        return new OcrEngine() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public OcrResult recognize(Page page) {
                return OcrResult.empty(id, page.index());
            }
        };
    }

    @Test
    void configuredPrimaryComesFirstWhicheverOrderEnginesArrive() {
        OcrEngine tesseract = engine("tesseract");
        OcrEngine gocr = engine("gocr");

        OcrEnginePair pair = OcrEnginePair.of("gocr", tesseract, gocr);

        assertSame(gocr, pair.primary());
        assertSame(tesseract, pair.secondary());
        assertEquals("gocr", pair.primaryId());
    }

    @Test
    void enginesMustBeDistinct() {
        assertThrows(IllegalArgumentException.class, () -> new OcrEnginePair(engine("gocr"), engine("gocr")));
    }
}
