package com.eyelevel.textextraction.client.monitor.progress;

import com.eyelevel.textextraction.model.DocumentFormat;
import com.eyelevel.textextraction.model.SourceKind;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The built-in stage profiles and their selection by format.
 */
public final class StageProfiles {

    public static final StageProfile OCR = new StageProfile("ocr", seconds(5, 10, 40, 15), true);
    public static final StageProfile OFFICE = new StageProfile("office", seconds(2, 8, 20, 5), false);
    public static final StageProfile PLAIN_TEXT = new StageProfile("plain-text", seconds(1, 2, 4, 2), false);
    public static final StageProfile DEFAULT = new StageProfile("default", seconds(3, 8, 30, 10), false);

    private static final Set<DocumentFormat> OFFICE_FORMATS = EnumSet.of(DocumentFormat.DOC, DocumentFormat.DOCX,
                                                                         DocumentFormat.ODT, DocumentFormat.RTF);

    private StageProfiles() {
    }

    /**
     * @param formatCode format code as reported by the status endpoint, may be null
     * @param sizeBytes  artifact size, or 0 when unknown
     */
    public static StageProfile forFormat(final String formatCode, final long sizeBytes) {
        return DocumentFormat.fromCode(formatCode).map(StageProfiles::forFormat).orElse(DEFAULT).scaledFor(sizeBytes);
    }

    private static StageProfile forFormat(final DocumentFormat format) {
        if (format.getSourceKind() == SourceKind.ASYNCHRONOUS_JOB) {
            return OCR;
        }
        return OFFICE_FORMATS.contains(format) ? OFFICE : PLAIN_TEXT;
    }

    private static List<Duration> seconds(final long... values) {
        return Arrays.stream(values).mapToObj(Duration::ofSeconds).toList();
    }
}
