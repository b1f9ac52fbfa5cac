package com.legacyforms.analyzer.export;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.model.AnalysisMessage;
import com.legacyforms.analyzer.model.FormDefinition;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a Markdown summary of an analyzed form from the
 * {@code form-summary.md.ftl} template.
 */
public class FormSummaryReportWriter {
    private static final Logger log = LoggerFactory.getLogger(FormSummaryReportWriter.class);

    static final String TEMPLATE_NAME = "form-summary.md.ftl";

    private final Configuration freemarkerConfig;

    public FormSummaryReportWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(FormDefinition form, List<AnalysisMessage> messages) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("form", form);
        model.put("metadata", form.getMetadata());
        model.put("views", form.getViews());
        model.put("mainColumns", form.mainColumns());
        model.put("repeatingGroups", form.repeatingColumnsBySection());
        model.put("dynamicSections", form.getDynamicSections());
        model.put("messages", messages);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Cannot render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    public Path write(FormDefinition form, List<AnalysisMessage> messages, Path outputFile) throws IOException {
        Files.createDirectories(outputFile.toAbsolutePath().getParent());
        Files.writeString(outputFile, render(form, messages));
        log.info("Wrote form summary: {}", outputFile);
        return outputFile;
    }
}
