package com.privatedocs.qa.service.ingestion;

import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.tika.metadata.HttpHeaders;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Text formats are decoded as UTF-8 directly; PDF and DOCX go through Tika with the declared media type as a hint.
 */
@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private final Parser parser = new AutoDetectParser();

    @Override
    public String extract(String filename, DocumentFormat format, InputStream inputStream) {
        String text;
        try {
            text = switch (format) {
                case TXT, MD -> decodeUtf8(inputStream);
                case PDF, DOCX -> parseBinary(filename, format, inputStream);
            };
        } catch (Exception e) {
            log.warn("Failed to extract text from {} ({}): {}", filename, format, e.getMessage());
            throw new DocQaException(ErrorKind.EXTRACTION, "Document " + filename + " could not be read", e);
        }
        if (text.isBlank()) {
            throw new DocQaException(ErrorKind.EXTRACTION, "No text could be extracted from " + filename);
        }
        log.debug("Extracted {} characters from {} as {}", text.length(), filename, format);
        return text.strip();
    }

    private static String decodeUtf8(InputStream inputStream) throws IOException {
        try (InputStream unmarked = BOMInputStream.builder().setInputStream(inputStream).get()) {
            return IOUtils.toString(unmarked, StandardCharsets.UTF_8);
        }
    }

    private String parseBinary(String filename, DocumentFormat format, InputStream inputStream) throws Exception {
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        metadata.set(HttpHeaders.CONTENT_TYPE, format.mediaType());
        BodyContentHandler handler = new BodyContentHandler(-1);
        parser.parse(inputStream, handler, metadata, new ParseContext());
        String detected = metadata.get(HttpHeaders.CONTENT_TYPE);
        if (detected != null && !detected.startsWith(format.mediaType())) {
            log.debug("{} declared as {} but detected as {}", filename, format.mediaType(), detected);
        }
        return handler.toString();
    }
}
