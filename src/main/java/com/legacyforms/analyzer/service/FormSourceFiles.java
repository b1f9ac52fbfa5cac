package com.legacyforms.analyzer.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Input files of one extracted form: the manifest (null when absent), view
 * templates in file-name order and schema files.
 */
public record FormSourceFiles(Path directory, Path manifest, List<Path> views, List<Path> schemas) {

    public boolean isEmpty() {
        return manifest == null && views.isEmpty() && schemas.isEmpty();
    }
}
