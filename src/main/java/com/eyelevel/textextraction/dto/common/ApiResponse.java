package com.eyelevel.textextraction.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Envelope for every response of the REST API, successful or not.
 */
@Getter
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * A message that can be shown to the user.
     */
    private final String displayMessage;

    /**
     * The payload. Absent on errors.
     */
    private final T response;

    /**
     * Technical detail of an error, absent on success.
     */
    private final String errorDetail;

    private final Boolean showMessage;

    private final Integer statusCode;

    public static <T> ApiResponse<T> success(final T response, final String displayMessage, final int statusCode) {
        return ApiResponse.<T>builder()
                          .response(response)
                          .displayMessage(displayMessage)
                          .showMessage(false)
                          .statusCode(statusCode)
                          .build();
    }

    public static ApiResponse<Object> error(final String displayMessage) {
        return error(displayMessage, null);
    }

    public static ApiResponse<Object> error(final String displayMessage, final String errorDetail) {
        return ApiResponse.builder()
                          .displayMessage(displayMessage)
                          .errorDetail(errorDetail)
                          .showMessage(true)
                          .build();
    }
}
