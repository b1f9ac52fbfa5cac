package com.legacyforms.analyzer.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Loads view templates into namespace-aware DOM trees. External entities and
 * DTDs are never fetched.
 */
public class ViewTemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(ViewTemplateLoader.class);

    public Document load(Path viewFile) {
        log.debug("Loading view template: {}", viewFile);
        try (InputStream in = Files.newInputStream(viewFile)) {
            return newBuilder().parse(in, viewFile.toUri().toString());
        } catch (IOException | SAXException e) {
            throw new ViewLoadException("Cannot load view " + viewFile.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public Document parse(String content) {
        try {
            return newBuilder().parse(new InputSource(new StringReader(content)));
        } catch (IOException | SAXException e) {
            throw new ViewLoadException("Cannot parse view markup: " + e.getMessage(), e);
        }
    }

    private DocumentBuilder newBuilder() {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setIgnoringComments(true);
        f.setCoalescing(true);
        f.setXIncludeAware(false);
        f.setExpandEntityReferences(false);
        try {
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);

            DocumentBuilder builder = f.newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new ViewLoadException("XML parser configuration rejected: " + e.getMessage(), e);
        }
    }

    private static final class LoggingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            log.debug("View markup warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) {
            log.debug("View markup error at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
