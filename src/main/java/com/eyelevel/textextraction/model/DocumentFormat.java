package com.eyelevel.textextraction.model;

import lombok.Getter;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Document formats accepted for extraction, with the backend each one is routed to.
 * Lookup accepts either a file extension or a MIME type.
 */
@Getter
public enum DocumentFormat {
    TXT(SourceKind.SYNCHRONOUS_TEXT, "text/plain", "txt", "text"),
    MARKDOWN(SourceKind.SYNCHRONOUS_TEXT, "text/markdown", "md", "markdown"),
    CSV(SourceKind.SYNCHRONOUS_TEXT, "text/csv", "csv"),
    HTML(SourceKind.SYNCHRONOUS_TEXT, "text/html", "html", "htm"),
    RTF(SourceKind.SYNCHRONOUS_TEXT, "application/rtf", "rtf"),
    DOC(SourceKind.SYNCHRONOUS_TEXT, "application/msword", "doc"),
    DOCX(SourceKind.SYNCHRONOUS_TEXT,
         "application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),
    ODT(SourceKind.SYNCHRONOUS_TEXT, "application/vnd.oasis.opendocument.text", "odt"),
    PDF(SourceKind.ASYNCHRONOUS_JOB, "application/pdf", "pdf"),
    PNG(SourceKind.ASYNCHRONOUS_JOB, "image/png", "png"),
    JPEG(SourceKind.ASYNCHRONOUS_JOB, "image/jpeg", "jpg", "jpeg"),
    TIFF(SourceKind.ASYNCHRONOUS_JOB, "image/tiff", "tif", "tiff");

    private static final Map<String, DocumentFormat> LOOKUP = Stream.of(values())
            .flatMap(format -> Stream.concat(format.extensions.stream(), Stream.of(format.mimeType))
                                     .map(key -> Map.entry(key, format)))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

    private final SourceKind sourceKind;
    private final String mimeType;
    private final Set<String> extensions;

    DocumentFormat(SourceKind sourceKind, String mimeType, String... extensions) {
        this.sourceKind = sourceKind;
        this.mimeType = mimeType;
        this.extensions = Set.of(extensions);
    }

    /**
     * Resolves a declared format, which may be an extension ({@code "pdf"}, {@code ".pdf"}) or a MIME type
     * ({@code "application/pdf"}). MIME parameters such as a charset are ignored.
     *
     * @param value the declared format, may be null
     * @return the matching format, or empty when the value is unknown
     */
    public static Optional<DocumentFormat> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        int parameterStart = normalized.indexOf(';');
        if (parameterStart >= 0) {
            normalized = normalized.substring(0, parameterStart).trim();
        }
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return Optional.ofNullable(LOOKUP.get(normalized));
    }

    /**
     * Resolves the format from the extension of a file name.
     */
    public static Optional<DocumentFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return fromValue(fileName.substring(dot + 1));
    }

    /**
     * Canonical lower-case name stored on records and sent to the OCR service.
     */
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a stored {@link #getCode() code}, falling back to extension or MIME lookup.
     */
    public static Optional<DocumentFormat> fromCode(String code) {
        return Stream.of(values()).filter(format -> format.getCode().equals(code)).findFirst()
                     .or(() -> fromValue(code));
    }
}
