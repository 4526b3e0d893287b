package com.eyelevel.textextraction.common.apiclient.authentication;

import java.util.Map;

/**
 * Adds the credentials of one authentication scheme to the headers of an outgoing request.
 */
public interface Authentication {

    /**
     * @param headers mutable header map of the request being prepared
     */
    void applyAuthentication(Map<String, String> headers);
}
