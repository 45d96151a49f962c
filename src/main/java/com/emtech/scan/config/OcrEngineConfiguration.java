package com.emtech.scan.config;

import com.emtech.scan.config.ScanProperties.TesseractProperties;
import com.emtech.scan.service.ocr.CommandLineOcrEngine;
import com.emtech.scan.service.ocr.OcrEnginePair;
import com.emtech.scan.service.ocr.ProcessCommandRunner;
import com.emtech.scan.service.ocr.TesseractOcrEngine;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two OCR engines. A missing Tesseract installation does not prevent start-up: the
 * engine is registered as unavailable and every page falls back to the command-line engine.
 */
@Configuration
public class OcrEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OcrEngineConfiguration.class);

    @Bean
    public TesseractOcrEngine tesseractOcrEngine(ScanProperties properties) {
        TesseractProperties tesseract = properties.ocr().tesseract();
        String language = tesseract.language() == null || tesseract.language().isBlank()
                ? "eng"
                : tesseract.language();
        String dataPath = tesseract.enabled() ? resolveDataPath(tesseract.datapath(), language) : null;
        if (dataPath == null) {
            log.warn("Tesseract engine '{}' is unavailable: no tessdata directory containing {}.traineddata. "
                    + "Provide it via emtechscan.ocr.tesseract.datapath or TESSDATA_PREFIX.", tesseract.id(), language);
            return new TesseractOcrEngine(tesseract.id(), Tesseract::new, false);
        }
        log.info("Configuring Tesseract engine '{}' with data path {} and language {}", tesseract.id(), dataPath, language);
        return new TesseractOcrEngine(tesseract.id(), () -> {
            Tesseract instance = new Tesseract();
            instance.setDatapath(dataPath);
            instance.setLanguage(language);
            instance.setOcrEngineMode(1); // LSTM only
            instance.setPageSegMode(3); // Fully automatic page segmentation
            instance.setVariable("user_defined_dpi", String.valueOf(properties.raster().dpi()));
            instance.setVariable("preserve_interword_spaces", "1");
            return instance;
        }, true);
    }

    @Bean
    public CommandLineOcrEngine commandLineOcrEngine(ScanProperties properties) {
        CommandLineOcrEngine engine = new CommandLineOcrEngine(properties.ocr().command(), new ProcessCommandRunner());
        if (engine.isAvailable()) {
            log.info("Command-line OCR engine '{}' found on PATH", engine.id());
        } else {
            log.warn("Command-line OCR engine '{}' not found on PATH; install it (e.g. apt install gocr cuneiform)",
                    engine.id());
        }
        return engine;
    }

    @Bean
    public OcrEnginePair ocrEnginePair(ScanProperties properties, TesseractOcrEngine tesseract,
            CommandLineOcrEngine commandLine) {
        OcrEnginePair pair = OcrEnginePair.of(properties.ocr().primaryEngine(), tesseract, commandLine);
        log.info("Primary OCR engine: {}, secondary: {}", pair.primaryId(), pair.secondary().id());
        return pair;
    }

    static String resolveDataPath(String configured, String language) {
        List<String> candidates = new ArrayList<>();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured);
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }

        candidates.add("/usr/share/tesseract-ocr/5/tessdata");
        candidates.add("/usr/share/tesseract-ocr/4.00/tessdata");
        candidates.add("/usr/share/tessdata");
        candidates.add("C:/Program Files/Tesseract-OCR/tessdata");

        for (String candidate : candidates) {
            Path validPath = validateCandidate(candidate, language);
            if (validPath != null) {
                return validPath.toString();
            }
        }
        return null;
    }

    private static Path validateCandidate(String candidate, String language) {
        Path basePath;
        try {
            basePath = Paths.get(candidate).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Tesseract data path candidate '{}' is invalid: {}", candidate, ex.getMessage());
            return null;
        }
        if (!Files.isDirectory(basePath)) {
            return null;
        }
        // Multi-language settings such as "eng+deu" need every model present.
        String[] languages = language.split("\\+");
        if (containsAll(basePath, languages)) {
            return basePath;
        }
        Path tessdataDirectory = basePath.resolve("tessdata");
        if (Files.isDirectory(tessdataDirectory) && containsAll(tessdataDirectory, languages)) {
            return tessdataDirectory;
        }
        log.debug("Tesseract data path candidate '{}' does not contain {}.traineddata", candidate, language);
        return null;
    }

    private static boolean containsAll(Path directory, String[] languages) {
        for (String language : languages) {
            if (!Files.isRegularFile(directory.resolve(language.trim() + ".traineddata"))) {
                return false;
            }
        }
        return true;
    }
}
