package com.legacyforms.analyzer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;

/**
 * Temporary directory holding an unpacked form. Closing it deletes the directory tree.
 */
@Getter
public class ExtractedForm implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractedForm.class);

    private final Path directory;

    public ExtractedForm(Path directory) {
        this.directory = directory;
    }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Could not list temporary form directory {}: {}", directory, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Could not delete {}: {}", path, e.getMessage());
            }
        }
        log.debug("Removed temporary form directory {}", directory);
    }
}
