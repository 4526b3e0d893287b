package com.eyelevel.textextraction.client.monitor.config;

import com.eyelevel.textextraction.client.error.ErrorTranslator;
import com.eyelevel.textextraction.client.monitor.DocumentStatusMonitor;
import com.eyelevel.textextraction.client.monitor.StatusSource;
import com.eyelevel.textextraction.client.monitor.WebClientStatusSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the document status monitor. Only active when {@code app.monitor.base-url} is set.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.monitor", name = "base-url")
@EnableConfigurationProperties(StatusMonitorProperties.class)
public class StatusMonitorConfiguration {

    @Bean("statusWebClient")
    public WebClient statusWebClient(final WebClient.Builder webClientBuilder,
                                     final StatusMonitorProperties properties) {
        log.info("Document status monitor targets {}", properties.getBaseUrl());
        return webClientBuilder.clone().baseUrl(properties.getBaseUrl()).build();
    }

    @Bean
    public StatusSource statusSource(@Qualifier("statusWebClient") final WebClient statusWebClient,
                                     final StatusMonitorProperties properties) {
        return new WebClientStatusSource(statusWebClient, properties.getRequestTimeout());
    }

    @Bean
    public ErrorTranslator errorTranslator() {
        return new ErrorTranslator();
    }

    @Bean
    public DocumentStatusMonitor documentStatusMonitor(final StatusSource statusSource,
                                                       final StatusMonitorProperties properties,
                                                       final ErrorTranslator errorTranslator) {
        return new DocumentStatusMonitor(statusSource, properties.toSettings(), errorTranslator);
    }
}
