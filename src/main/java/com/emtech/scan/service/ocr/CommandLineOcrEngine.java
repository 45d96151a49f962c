package com.emtech.scan.service.ocr;

import com.emtech.scan.config.ScanProperties.CommandProperties;
import com.emtech.scan.exception.EngineUnavailableException;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.Page;
import com.emtech.scan.service.ocr.CommandRunner.CommandOutput;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine that shells out to a classical command-line recognizer. {@code gocr} prints the text to
 * stdout; {@code cuneiform} is asked to write a plain-text output file. Neither reports token
 * confidences.
 */
public class CommandLineOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(CommandLineOcrEngine.class);

    enum OutputStyle {
        STDOUT,
        OUTPUT_FILE
    }

    private final CommandProperties properties;
    private final CommandRunner runner;
    private final OutputStyle style;
    private final String id;

    public CommandLineOcrEngine(CommandProperties properties, CommandRunner runner) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.id = engineName(properties.executable());
        this.style = id.startsWith("cuneiform") ? OutputStyle.OUTPUT_FILE : OutputStyle.STDOUT;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isAvailable() {
        return ExecutableLocator.locate(properties.executable()).isPresent();
    }

    @Override
    public OcrResult recognize(Page page) {
        Path ownedImage = null;
        Path outputFile = null;
        try {
            Path image = page.imageFile().orElse(null);
            if (image == null || !Files.exists(image)) {
                ownedImage = writeTemporaryImage(page);
                image = ownedImage;
            }
            if (style == OutputStyle.OUTPUT_FILE) {
                outputFile = Files.createTempFile("ocr-" + id + "-", ".txt");
            }
            CommandOutput output = runner.run(buildCommand(image, outputFile), properties.timeout());
            String text = style == OutputStyle.OUTPUT_FILE
                    ? readOutputFile(outputFile)
                    : output.stdout();
            if (output.exitCode() != 0) {
                log.warn("{} exited with status {} on page {}", id, output.exitCode(), page.index());
            }
            OcrResult result = OcrResult.fromText(id, page.index(), text == null ? "" : text.strip());
            log.debug("{} recognized {} tokens on page {}", id, result.tokens().size(), page.index());
            return result;
        } catch (IOException ex) {
            throw new EngineUnavailableException(id, page.index(),
                    "Unable to invoke " + properties.executable() + ": " + ex.getMessage(), ex);
        } catch (TimeoutException ex) {
            throw new EngineUnavailableException(id, page.index(),
                    id + " timed out on page " + page.index(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException(id, page.index(),
                    id + " was interrupted on page " + page.index(), ex);
        } finally {
            deleteQuietly(ownedImage);
            deleteQuietly(outputFile);
        }
    }

    List<String> buildCommand(Path image, Path outputFile) {
        List<String> command = new ArrayList<>();
        command.add(properties.executable());
        if (style == OutputStyle.OUTPUT_FILE) {
            command.add("-l");
            command.add(properties.language());
            command.add("-f");
            command.add("text");
            command.add("-o");
            command.add(outputFile.toString());
        }
        command.add(image.toString());
        return command;
    }

    private Path writeTemporaryImage(Page page) throws IOException {
        BufferedImage bitmap = page.bitmap()
                .orElseThrow(() -> new IllegalStateException("Page " + page.index() + " has no bitmap"));
        Path temp = Files.createTempFile("ocr-page-", ".png");
        ImageIO.write(bitmap, "png", temp.toFile());
        return temp;
    }

    private static String readOutputFile(Path outputFile) throws IOException {
        if (outputFile == null || !Files.exists(outputFile)) {
            return "";
        }
        byte[] bytes = Files.readAllBytes(outputFile);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String engineName(String executable) {
        Objects.requireNonNull(executable, "executable");
        Path fileName = Path.of(executable).getFileName();
        String name = fileName == null ? executable : fileName.toString();
        return name.toLowerCase(Locale.ROOT).replaceFirst("\\.exe$", "");
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.debug("Unable to delete temporary OCR file {}: {}", path, ex.getMessage());
        }
    }
}
