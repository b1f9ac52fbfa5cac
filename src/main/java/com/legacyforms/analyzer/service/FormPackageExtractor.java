package com.legacyforms.analyzer.service;

import java.nio.file.Path;

/**
 * Unpacks a form package into a temporary working directory.
 */
public interface FormPackageExtractor {

    boolean supports(Path formPackage);

    /**
     * @throws FormExtractionException if the package cannot be unpacked
     */
    ExtractedForm extract(Path formPackage);
}
