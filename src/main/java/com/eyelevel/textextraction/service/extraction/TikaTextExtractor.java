package com.eyelevel.textextraction.service.extraction;

import com.eyelevel.textextraction.exception.ExtractionException;
import com.eyelevel.textextraction.model.DocumentFormat;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.SourceKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.EncryptedDocumentException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.exception.ZeroByteFileException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Extracts text from office and plain-text formats with Apache Tika.
 */
@Slf4j
@Component
public class TikaTextExtractor implements TextExtractor {

    private static final int MAX_TEXT_LENGTH = 10 * 1024 * 1024;

    private final AutoDetectParser parser;

    public TikaTextExtractor() {
        this.parser = new AutoDetectParser();
    }

    @Override
    public boolean supports(final DocumentFormat format) {
        return format.getSourceKind() == SourceKind.SYNCHRONOUS_TEXT;
    }

    @Override
    public String extract(final byte[] content, final DocumentFormat format) {
        try (InputStream inputStream = new ByteArrayInputStream(content)) {
            final Metadata metadata = new Metadata();
            metadata.set(Metadata.CONTENT_TYPE, format.getMimeType());
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, "document." + format.getCode());

            final BodyContentHandler handler = new BodyContentHandler(MAX_TEXT_LENGTH);
            parser.parse(inputStream, handler, metadata, new ParseContext());

            final String text = handler.toString();
            log.info("Extracted {} characters from {} document.", text.length(), format.getCode());
            return text;
        } catch (final ZeroByteFileException e) {
            log.info("Empty {} document, nothing to extract.", format.getCode());
            return "";
        } catch (final EncryptedDocumentException e) {
            throw new ExtractionException(ErrorKind.DOCUMENT_PROTECTED,
                                          "The document is password-protected or encrypted.", e);
        } catch (final SAXException e) {
            if (WriteLimitReachedException.isWriteLimitReached(e)) {
                throw new ExtractionException(ErrorKind.DOCUMENT_TOO_LARGE,
                                              "The document contains more text than can be extracted.", e);
            }
            throw new ExtractionException(ErrorKind.DOCUMENT_CORRUPTED, "Failed to read document: " + e.getMessage(), e);
        } catch (final TikaException | IOException e) {
            log.warn("Tika could not parse {} document: {}", format.getCode(), e.getMessage());
            throw new ExtractionException(ErrorKind.DOCUMENT_CORRUPTED, "Failed to read document: " + e.getMessage(), e);
        }
    }
}
