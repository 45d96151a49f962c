package com.emtech.scan.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.emtech.scan.model.MatchMode;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.Page;
import com.emtech.scan.model.TermDefinition;
import com.emtech.scan.service.matching.TermCatalog;
import com.emtech.scan.service.ocr.OcrEngine;
import com.emtech.scan.service.ocr.OcrEnginePair;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CatalogController.class)
@Import(CatalogControllerMvcTest.TestConfig.class)
class CatalogControllerMvcTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsConfiguredTerms() throws Exception {
        mockMvc.perform(get("/api/v1/catalog/terms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].term").value("quantum computing"))
                .andExpect(jsonPath("$[0].mode").value("FUZZY"))
                .andExpect(jsonPath("$[1].category").value("biotech"));
    }

    @Test
    void reportsEngineAvailabilityWithPrimaryFirst() throws Exception {
        mockMvc.perform(get("/api/v1/catalog/engines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("tesseract"))
                .andExpect(jsonPath("$[0].primary").value(true))
                .andExpect(jsonPath("$[0].available").value(true))
                .andExpect(jsonPath("$[1].id").value("gocr"))
                .andExpect(jsonPath("$[1].primary").value(false))
                .andExpect(jsonPath("$[1].available").value(false));
    }

    @TestConfiguration
    static class TestConfig {

        @Bean
        TermCatalog termCatalog() {
            return new TermCatalog(List.of(
                    TermDefinition.of("quantum computing", MatchMode.FUZZY, "computing"),
                    TermDefinition.of("CRISPR", MatchMode.CASE_INSENSITIVE, "biotech")), 0.5, 2, 40);
        }

        @Bean
        OcrEnginePair ocrEnginePair() {
            return new OcrEnginePair(engine("tesseract", true), engine("gocr", false));
        }

        private static OcrEngine engine(String id, boolean available) {
            return new OcrEngine() {
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
                    return OcrResult.empty(id, page.index());
                }
            };
        }
    }
}
