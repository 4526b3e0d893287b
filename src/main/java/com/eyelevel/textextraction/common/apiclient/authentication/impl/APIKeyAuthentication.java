package com.eyelevel.textextraction.common.apiclient.authentication.impl;

import com.eyelevel.textextraction.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends a static API key in a configurable header.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("No API key configured, sending request without '{}' header.", headerName);
            return;
        }
        headers.put(headerName, apiKey);
    }
}
