package com.eyelevel.textextraction.common.apiclient.ocr.config;

import com.eyelevel.textextraction.common.apiclient.authentication.Authentication;
import com.eyelevel.textextraction.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.textextraction.common.apiclient.model.HeaderConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Beans used by {@code OcrJobApiClient}: the {@link WebClient}, API key authentication and
 * static headers.
 */
@Slf4j
@Configuration
public class OcrApiClientConfiguration {

    @Value("${app.ocr-client.baseurl}")
    private String baseUrl;

    @Value("${app.ocr-client.auth-key-name}")
    private String headerName;

    @Value("${app.ocr-client.auth-key-value:}")
    private String headerValue;

    @Value("${spring.application.name:text-extraction-service}")
    private String applicationName;

    @Bean("ocrWebClient")
    public WebClient ocrWebClient(WebClient.Builder webClientBuilder) {
        log.info("Initializing OCR WebClient with base URL: {}", baseUrl);
        return webClientBuilder.clone().baseUrl(baseUrl).build();
    }

    @Bean("ocrAuthentication")
    public Authentication ocrAuthentication() {
        if (headerValue == null || headerValue.isBlank()) {
            log.warn("OCR API key is not configured. Job submissions may fail authentication.");
        }
        return new APIKeyAuthentication(headerName, headerValue);
    }

    @Bean("ocrHeader")
    public HeaderConfig ocrHeader() {
        return new OcrHeaderConfig().addHeader("X-Client-Name", applicationName);
    }

    static class OcrHeaderConfig extends HeaderConfig {
    }
}
