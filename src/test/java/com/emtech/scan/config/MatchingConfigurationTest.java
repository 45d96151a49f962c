package com.emtech.scan.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.emtech.scan.config.ScanProperties.MatchingProperties;
import com.emtech.scan.model.MatchMode;
import com.emtech.scan.model.TermDefinition;
import com.emtech.scan.service.matching.TermCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class MatchingConfigurationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    @TempDir
    Path tempDir;

    @Test
    void readsTermDefinitionsFromClasspathJson() {
        List<TermDefinition> terms = MatchingConfiguration.loadTerms("classpath:terms-test.json", resourceLoader, objectMapper);

        assertThat(terms).extracting(TermDefinition::term)
                .containsExactly("quantum computing", "AI", "\\bcrispr\\b");
        assertThat(terms.get(0).mode()).isEqualTo(MatchMode.FUZZY);
        assertThat(terms.get(0).maxDistance()).isEqualTo(2);
        assertThat(terms.get(1).wholeWord()).isTrue();
        assertThat(terms.get(2).minConfidence()).isEqualTo(0.5);
        assertThat(terms.get(2).certainty()).isEqualTo(0.9);
    }

    @Test
    void readsTermDefinitionsFromFileSystemPath() throws Exception {
        Path file = tempDir.resolve("terms.json");
        Files.writeString(file, "[{\"term\": \"hypersonic\", \"category\": \"aerospace\"}]");

        List<TermDefinition> terms = MatchingConfiguration.loadTerms(file.toString(), resourceLoader, objectMapper);

        assertThat(terms).containsExactly(new TermDefinition("hypersonic", MatchMode.CASE_INSENSITIVE, "aerospace",
                null, null, true, 1.0));
    }

    @Test
    void combinesInlineTermsWithTermsFile() {
        MatchingProperties matching = new MatchingProperties(0.4, 30, 1,
                List.of(TermDefinition.of("blockchain", MatchMode.FUZZY, "ledger")), "classpath:terms-test.json");
        ScanProperties properties = new ScanProperties(ScanProperties.RasterProperties.defaults(),
                ScanProperties.OcrProperties.defaults(), ScanProperties.ConsensusProperties.defaults(), matching,
                ScanProperties.PipelineProperties.defaults());

        TermCatalog catalog = new MatchingConfiguration().termCatalog(properties, objectMapper, resourceLoader);

        assertThat(catalog.size()).isEqualTo(4);
        assertThat(catalog.minConfidence()).isEqualTo(0.4);
        assertThat(catalog.contextChars()).isEqualTo(30);
    }

    @Test
    void missingTermsFileFailsStartup() {
        assertThatThrownBy(() -> MatchingConfiguration.loadTerms("classpath:nope.json", resourceLoader, objectMapper))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nope.json");
    }
}
