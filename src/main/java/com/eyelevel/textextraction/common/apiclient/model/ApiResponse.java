package com.eyelevel.textextraction.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Raw successful response of an external API call. The body is kept as bytes and decoded by the
 * concrete client.
 */
@Builder
@Getter
public class ApiResponse {

    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    private final int statusCode;

    /**
     * When the response was received.
     */
    private final Instant timestamp;
}
