package com.eyelevel.textextraction.service.ingestion;

import com.eyelevel.textextraction.model.DocumentFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Resolves the {@link DocumentFormat} of an upload.
 *
 * <p>An explicitly declared format is authoritative: if it is unknown the artifact is unsupported even
 * when the file name looks fine. Without a declared format the file extension is used, then the
 * upload's content type.
 */
@Slf4j
@Component
public class FormatClassifier {

    public Optional<DocumentFormat> classify(final IngestionCommand command) {
        if (StringUtils.hasText(command.declaredFormat())) {
            final Optional<DocumentFormat> declared = DocumentFormat.fromValue(command.declaredFormat());
            if (declared.isEmpty()) {
                log.info("Declared format '{}' of '{}' is not supported.", command.declaredFormat(),
                         command.fileName());
            }
            return declared;
        }
        return DocumentFormat.fromFileName(command.fileName())
                             .or(() -> DocumentFormat.fromValue(command.contentType()));
    }
}
