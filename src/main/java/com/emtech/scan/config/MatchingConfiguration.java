package com.emtech.scan.config;

import com.emtech.scan.config.ScanProperties.MatchingProperties;
import com.emtech.scan.model.TermDefinition;
import com.emtech.scan.service.matching.TermCatalog;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.ResourceUtils;

/**
 * Builds the term catalog once at start-up from the inline term list and the optional JSON terms
 * file. The file holds an array of term definitions.
 */
@Configuration
public class MatchingConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MatchingConfiguration.class);

    private static final TypeReference<List<TermDefinition>> TERM_LIST = new TypeReference<>() {
    };

    @Bean
    public TermCatalog termCatalog(ScanProperties properties, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        MatchingProperties matching = properties.matching();
        List<TermDefinition> definitions = new ArrayList<>(matching.terms());
        if (matching.termsFile() != null && !matching.termsFile().isBlank()) {
            definitions.addAll(loadTerms(matching.termsFile(), resourceLoader, objectMapper));
        }
        TermCatalog catalog = TermCatalog.of(definitions, matching);
        if (catalog.isEmpty()) {
            log.warn("No technology terms configured; scans will report no hits");
        } else {
            log.info("Loaded {} technology term(s), minimum hit confidence {}", catalog.size(), catalog.minConfidence());
        }
        return catalog;
    }

    static List<TermDefinition> loadTerms(String location, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resolve(location, resourceLoader);
        if (!resource.exists()) {
            throw new IllegalStateException("Terms file not found: " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            List<TermDefinition> terms = objectMapper.readValue(input, TERM_LIST);
            log.info("Read {} term(s) from {}", terms == null ? 0 : terms.size(), location);
            return terms == null ? List.of() : terms;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read terms file " + location, ex);
        }
    }

    private static Resource resolve(String location, ResourceLoader resourceLoader) {
        if (!ResourceUtils.isUrl(location)) {
            Path path = Path.of(location);
            if (Files.exists(path)) {
                return new FileSystemResource(path);
            }
        }
        return resourceLoader.getResource(location);
    }
}
