package com.emtech.scan.service.ocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExecutableLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void findsExecutableOnSearchPath() throws Exception {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        Path gocr = Files.createFile(bin.resolve("gocr"));
        assumeTrue(gocr.toFile().setExecutable(true), "file system does not support executable bits");

        String searchPath = tempDir.resolve("missing") + File.pathSeparator + bin;

        assertThat(ExecutableLocator.locate("gocr", searchPath)).contains(gocr);
    }

    @Test
    void returnsEmptyWhenNotFound() {
        assertThat(ExecutableLocator.locate("cuneiform", tempDir.toString())).isEmpty();
        assertThat(ExecutableLocator.locate("gocr", null)).isEmpty();
        assertThat(ExecutableLocator.locate(" ", tempDir.toString())).isEmpty();
    }
}
