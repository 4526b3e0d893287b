package com.eyelevel.textextraction.service.extraction;

import com.eyelevel.textextraction.model.DocumentFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks the first registered {@link TextExtractor} that supports a format.
 */
@Service
@Slf4j
public class TextExtractorFactory {

    private final List<TextExtractor> extractors;

    public TextExtractorFactory(List<TextExtractor> extractors) {
        this.extractors = extractors;
        log.info("TextExtractorFactory initialized with {} available extractors.", extractors.size());
    }

    public Optional<TextExtractor> getExtractor(DocumentFormat format) {
        Optional<TextExtractor> extractor = extractors.stream().filter(e -> e.supports(format)).findFirst();
        log.debug("Extractor for format '{}': {}", format.getCode(),
                  extractor.map(e -> e.getClass().getSimpleName()).orElse("None"));
        return extractor;
    }
}
