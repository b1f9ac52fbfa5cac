package com.legacyforms.analyzer.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.legacyforms.analyzer.model.FormDefinition;

/**
 * Writes the finished form model as JSON. Model fields are serialized
 * directly, so convenience accessors do not leak into the output.
 */
public class FormJsonExporter {
    private static final Logger log = LoggerFactory.getLogger(FormJsonExporter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    public String toJson(FormDefinition form) throws JsonProcessingException {
        return mapper.writeValueAsString(form);
    }

    public Path write(FormDefinition form, Path outputFile) throws IOException {
        Files.createDirectories(outputFile.toAbsolutePath().getParent());
        Files.writeString(outputFile, toJson(form));
        log.info("Wrote form model: {}", outputFile);
        return outputFile;
    }
}
