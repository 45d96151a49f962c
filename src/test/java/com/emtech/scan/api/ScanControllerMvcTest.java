package com.emtech.scan.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.emtech.scan.model.Document;
import com.emtech.scan.model.Hit;
import com.emtech.scan.model.MatchMode;
import com.emtech.scan.model.PageOutcome;
import com.emtech.scan.model.PageStatus;
import com.emtech.scan.model.ScanReport;
import com.emtech.scan.model.ScanStatus;
import com.emtech.scan.service.pipeline.ScanJob;
import com.emtech.scan.service.pipeline.ScanJobService;
import com.emtech.scan.service.pipeline.ScanPipeline;
import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(ScanController.class)
@Import({ScanTextExporter.class, ScanDocxExporter.class})
class ScanControllerMvcTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScanPipeline scanPipeline;

    @MockBean
    private ScanJobService scanJobService;

    private static ScanReport report() {
        Hit hit = new Hit("doc-1", 0, "quantum computing", "computing", MatchMode.FUZZY, 12, 29,
                "quantum computmg", 0.9, "advances in quantum computmg");
        List<PageOutcome> pages = List.of(
                new PageOutcome(0, PageStatus.MATCHED, null, 0.9, 1, 0, "advances in quantum computmg"),
                PageOutcome.failed(1, "Both OCR engines unavailable"));
        return new ScanReport("doc-1", "paper.pdf", ScanStatus.COMPLETED, null, List.of(hit),
                Map.of("computing", 1L), pages);
    }

    @Test
    void scanUploadReturnsReport() throws Exception {
        when(scanPipeline.scan(any(Document.class))).thenReturn(report());
        MockMultipartFile file = new MockMultipartFile("document", "paper.pdf", "application/pdf", new byte[] {1, 2, 3});

        mockMvc.perform(multipart("/api/v1/scans").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.totalPages").value(2))
                .andExpect(jsonPath("$.failedPages[0]").value(1))
                .andExpect(jsonPath("$.hits[0].term").value("quantum computing"))
                .andExpect(jsonPath("$.categoryCounts.computing").value(1));
    }

    @Test
    void scanUploadRejectsEmptyFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("document", "empty.pdf", "application/pdf", new byte[0]);

        mockMvc.perform(multipart("/api/v1/scans").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Document file is required"));
        verify(scanPipeline, never()).scan(any(Document.class));
    }

    @Test
    void scanBase64ReturnsBadRequestWhenContentIsBlank() throws Exception {
        mockMvc.perform(post("/api/v1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"paper.pdf\",\"contentBase64\":\"   \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void scanBase64ReturnsBadRequestWhenContentDecodesToNothing() throws Exception {
        mockMvc.perform(post("/api/v1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"paper.pdf\",\"contentBase64\":\"@@@\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Document data is empty"));
    }

    @Test
    void scanBase64DecodesDocument() throws Exception {
        when(scanPipeline.scan(any(Document.class))).thenReturn(report());

        mockMvc.perform(post("/api/v1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"paper.pdf\",\"contentBase64\":\"AQID\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentName").value("paper.pdf"));
    }

    @Test
    void submitJobIsAccepted() throws Exception {
        when(scanJobService.submit(any(Document.class))).thenReturn(new ScanJob(3, "doc-1", "paper.pdf"));
        MockMultipartFile file = new MockMultipartFile("document", "paper.pdf", "application/pdf", new byte[] {1});

        mockMvc.perform(multipart("/api/v1/scans/jobs").file(file))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.state").value("QUEUED"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(scanJobService.find(42)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/scans/jobs/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.path").value("/api/v1/scans/jobs/42"));
    }

    @Test
    void cancelJobIsAccepted() throws Exception {
        when(scanJobService.cancel(5)).thenReturn(Optional.of(new ScanJob(5, "doc-1", "paper.pdf")));

        mockMvc.perform(delete("/api/v1/scans/jobs/5"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(5));
    }

    @Test
    void textOfUnfinishedJobIsConflict() throws Exception {
        when(scanJobService.find(7)).thenReturn(Optional.of(new ScanJob(7, "doc-1", "paper.pdf")));

        mockMvc.perform(get("/api/v1/scans/jobs/7/text"))
                .andExpect(status().isConflict());
    }

    @Test
    void textOfFinishedJobListsPages() throws Exception {
        ScanJob job = mock(ScanJob.class);
        when(job.getReport()).thenReturn(Optional.of(report()));
        when(scanJobService.find(8)).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/v1/scans/jobs/8/text"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("--- page 1 ---\nadvances in quantum computmg")))
                .andExpect(content().string(containsString("[not processed: Both OCR engines unavailable]")));
    }

    @Test
    void docxOfFinishedJobHasOneParagraphPerPage() throws Exception {
        ScanJob job = mock(ScanJob.class);
        when(job.getReport()).thenReturn(Optional.of(report()));
        when(job.getDocumentName()).thenReturn("paper.pdf");
        when(scanJobService.find(9)).thenReturn(Optional.of(job));

        MvcResult result = mockMvc.perform(get("/api/v1/scans/jobs/9/docx"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(ScanDocxExporter.MEDIA_TYPE))
                .andExpect(header().string("Content-Disposition", containsString("paper.docx")))
                .andReturn();

        try (XWPFDocument document = new XWPFDocument(
                new ByteArrayInputStream(result.getResponse().getContentAsByteArray()))) {
            List<String> paragraphs = document.getParagraphs().stream().map(XWPFParagraph::getText).toList();
            assertThat(paragraphs).containsSubsequence(
                    "Page 1", "advances in quantum computmg",
                    "Page 2", "[not processed: Both OCR engines unavailable]");
        }
    }

    @Test
    void docxOfUnfinishedJobIsConflict() throws Exception {
        when(scanJobService.find(10)).thenReturn(Optional.of(new ScanJob(10, "doc-1", "paper.pdf")));

        mockMvc.perform(get("/api/v1/scans/jobs/10/docx"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Scan job 10 has not finished"));
    }
}
