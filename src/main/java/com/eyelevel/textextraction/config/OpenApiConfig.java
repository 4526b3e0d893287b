package com.eyelevel.textextraction.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        final String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        final String appName = buildProperties.map(BuildProperties::getName).orElse("Text Extraction API");

        return new OpenAPI()
                .info(new Info().title(appName)
                                .version(version)
                                .description("""
                                        Extracts text from uploaded documents.

                                        * **Synchronous formats:** plain text, markdown, CSV, HTML, RTF and office documents are \
                                        extracted during the upload request.
                                        * **OCR formats:** PDFs and images are sent to the OCR service. The document stays \
                                        PROCESSING until a background reconciliation pass records the result or a timeout.
                                        * **Status:** poll `GET /documents/{id}/status` for the outcome. Failures carry an \
                                        error kind, a message and whether a retry may help.
                                        * **Retry:** `POST /documents/{id}/retry` restarts a document that failed with a \
                                        retryable error.
                                        """)
                                .contact(new Contact()
                                                 .name("EyeLevel.ai Support")
                                                 .url("https://www.eyelevel.ai")));
    }
}
