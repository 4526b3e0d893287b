package com.eyelevel.textextraction.client.error;

import com.eyelevel.textextraction.model.ErrorKind;

/**
 * An error ready to show to a user.
 *
 * @param retryAllowed whether offering an explicit retry makes sense; the monitor never retries on its own
 * @param kind         the backend kind this was translated from, null for transport and client-side errors
 */
public record UserFacingError(UserErrorCategory category, String message, String remediationHint,
                              boolean retryAllowed, ErrorKind kind) {

    public String title() {
        return category.getTitle();
    }
}
