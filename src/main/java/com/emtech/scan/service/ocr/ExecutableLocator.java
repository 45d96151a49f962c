package com.emtech.scan.service.ocr;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves an executable name against the {@code PATH} environment variable.
 */
public final class ExecutableLocator {

    private ExecutableLocator() {
    }

    public static Optional<Path> locate(String executable) {
        return locate(executable, System.getenv("PATH"));
    }

    static Optional<Path> locate(String executable, String searchPath) {
        if (executable == null || executable.isBlank()) {
            return Optional.empty();
        }
        try {
            if (executable.contains(File.separator) || executable.contains("/")) {
                Path direct = Path.of(executable);
                return Files.isRegularFile(direct) && Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
            }
            if (searchPath == null || searchPath.isBlank()) {
                return Optional.empty();
            }
            for (String directory : searchPath.split(File.pathSeparator)) {
                if (directory.isBlank()) {
                    continue;
                }
                Path candidate = Path.of(directory, executable);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        } catch (InvalidPathException ex) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
