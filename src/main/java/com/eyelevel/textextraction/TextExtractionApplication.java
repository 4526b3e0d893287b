package com.eyelevel.textextraction;

import com.eyelevel.textextraction.config.ExtractionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the text extraction service.
 * <ul>
 *     <li>{@link EnableScheduling}: runs the reconciliation pass on its configured cadence.</li>
 *     <li>{@link EnableRetry}: retries OCR job submission on transient failures.</li>
 *     <li>{@link EnableConfigurationProperties}: binds {@code app.extraction} to {@link ExtractionProperties}.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = ExtractionProperties.class)
@EnableRetry
public class TextExtractionApplication {

    public static void main(final String[] args) {
        log.info("Starting TextExtractionApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(TextExtractionApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "TextExtraction"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                                                         ? env.getActiveProfiles()
                                                         : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
