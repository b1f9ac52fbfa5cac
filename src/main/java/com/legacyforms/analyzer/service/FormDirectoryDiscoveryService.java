package com.legacyforms.analyzer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class FormDirectoryDiscoveryService {

    public static final String MANIFEST_FILE = "manifest.xsf";

    public FormSourceFiles discover(Path formDir) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.walk(formDir, 1)) {
            files = stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT)))
                    .collect(Collectors.toList());
        }

        Path manifest = files.stream()
                .filter(p -> lowerName(p).equals(MANIFEST_FILE))
                .findFirst()
                .orElse(null);
        List<Path> views = files.stream().filter(this::isViewFile).toList();
        List<Path> schemas = files.stream().filter(p -> lowerName(p).endsWith(".xsd")).toList();

        return new FormSourceFiles(formDir, manifest, views, schemas);
    }

    private boolean isViewFile(Path path) {
        String name = lowerName(path);
        return name.startsWith("view") && name.endsWith(".xsl");
    }

    private static String lowerName(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
