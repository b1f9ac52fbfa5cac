package com.legacyforms.analyzer.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts ZIP-format form packages. Entries that would land outside the
 * working directory are rejected.
 */
public class ZipFormPackageExtractor implements FormPackageExtractor {
    private static final Logger log = LoggerFactory.getLogger(ZipFormPackageExtractor.class);

    @Override
    public boolean supports(Path formPackage) {
        String name = formPackage.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".zip");
    }

    @Override
    public ExtractedForm extract(Path formPackage) {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("infopath-form-");
        } catch (IOException e) {
            throw new FormExtractionException("Cannot create working directory: " + e.getMessage(), e);
        }

        ExtractedForm extracted = new ExtractedForm(workDir);
        try (InputStream in = Files.newInputStream(formPackage); ZipInputStream zip = new ZipInputStream(in)) {
            int count = 0;
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = workDir.resolve(entry.getName()).normalize();
                if (!target.startsWith(workDir)) {
                    throw new FormExtractionException("Package entry escapes working directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                    count++;
                }
            }
            log.info("Extracted {} files from {}", count, formPackage.getFileName());
            return extracted;
        } catch (IOException | RuntimeException e) {
            extracted.close();
            if (e instanceof FormExtractionException fe) {
                throw fe;
            }
            throw new FormExtractionException("Cannot extract " + formPackage.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
