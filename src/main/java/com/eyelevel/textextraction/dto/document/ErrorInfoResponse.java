package com.eyelevel.textextraction.dto.document;

import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;

public record ErrorInfoResponse(ErrorKind kind, String message, boolean retryable) {

    public static ErrorInfoResponse from(final ErrorInfo errorInfo) {
        return errorInfo == null ? null
                                 : new ErrorInfoResponse(errorInfo.kind(), errorInfo.message(), errorInfo.retryable());
    }
}
