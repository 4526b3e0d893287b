package com.eyelevel.textextraction.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything {@code ApiClient} needs to send one request.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL, may contain {@code {placeholders}} resolved from
     * {@link #pathVariables}.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    @Builder.Default
    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    /**
     * Content type of {@link #body}, JSON when not set.
     */
    @Nullable
    private final MediaType contentType;
}
