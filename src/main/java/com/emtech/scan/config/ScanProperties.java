package com.emtech.scan.config;

import com.emtech.scan.model.TermDefinition;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "emtechscan")
public record ScanProperties(
        @DefaultValue RasterProperties raster,
        @DefaultValue OcrProperties ocr,
        @DefaultValue ConsensusProperties consensus,
        @DefaultValue MatchingProperties matching,
        @DefaultValue PipelineProperties pipeline) {

    public static ScanProperties defaults() {
        return new ScanProperties(
                RasterProperties.defaults(),
                OcrProperties.defaults(),
                ConsensusProperties.defaults(),
                MatchingProperties.defaults(),
                PipelineProperties.defaults());
    }

    public record RasterProperties(
            @DefaultValue("300") int dpi,
            @DefaultValue("true") boolean preprocess,
            @DefaultValue("0") int maxPages,
            @DefaultValue("emtechscan-") String tempPrefix) {

        public static RasterProperties defaults() {
            return new RasterProperties(300, true, 0, "emtechscan-");
        }
    }

    public record OcrProperties(
            @DefaultValue("tesseract") String primaryEngine,
            @DefaultValue("60s") Duration pageTimeout,
            @DefaultValue TesseractProperties tesseract,
            @DefaultValue CommandProperties command) {

        public static OcrProperties defaults() {
            return new OcrProperties("tesseract", Duration.ofSeconds(60),
                    TesseractProperties.defaults(), CommandProperties.defaults());
        }
    }

    public record TesseractProperties(
            @DefaultValue("tesseract") String id,
            String datapath,
            @DefaultValue("eng") String language,
            @DefaultValue("true") boolean enabled) {

        public static TesseractProperties defaults() {
            return new TesseractProperties("tesseract", null, "eng", true);
        }
    }

    /**
     * External recognizer launched as a process. Supported executables are {@code gocr}, which
     * prints text to stdout, and {@code cuneiform}, which writes an output file.
     */
    public record CommandProperties(
            @DefaultValue("gocr") String executable,
            @DefaultValue("eng") String language,
            @DefaultValue("60s") Duration timeout) {

        public static CommandProperties defaults() {
            return new CommandProperties("gocr", "eng", Duration.ofSeconds(60));
        }
    }

    public record ConsensusProperties(
            @DefaultValue("1.0") double agreementConfidence,
            @DefaultValue("0.6") double disagreementConfidence,
            @DefaultValue("0.35") double exclusiveConfidence,
            @DefaultValue("0.6") double singleEngineConfidence) {

        public static ConsensusProperties defaults() {
            return new ConsensusProperties(1.0, 0.6, 0.35, 0.6);
        }
    }

    public record MatchingProperties(
            @DefaultValue("0.3") double minConfidence,
            @DefaultValue("40") int contextChars,
            @DefaultValue("1") int defaultFuzzyDistance,
            List<TermDefinition> terms,
            String termsFile) {

        public MatchingProperties {
            terms = terms == null ? List.of() : List.copyOf(terms);
        }

        public static MatchingProperties defaults() {
            return new MatchingProperties(0.3, 40, 1, List.of(), null);
        }
    }

    public record PipelineProperties(
            @DefaultValue("0") int pageWorkers,
            @DefaultValue("0") int engineWorkers,
            @DefaultValue("2") int scanWorkers,
            @DefaultValue("10s") Duration cancelGracePeriod,
            @DefaultValue("100") int maxJobsRetained) {

        public static PipelineProperties defaults() {
            return new PipelineProperties(0, 0, 2, Duration.ofSeconds(10), 100);
        }

        public int effectivePageWorkers() {
            return pageWorkers > 0 ? pageWorkers : Math.max(1, Runtime.getRuntime().availableProcessors());
        }

        public int effectiveEngineWorkers() {
            return engineWorkers > 0 ? engineWorkers : effectivePageWorkers() * 2;
        }
    }
}
