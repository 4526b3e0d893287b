package com.eyelevel.textextraction.common.json;

/**
 * Decodes JSON payloads received from external services.
 */
public interface JsonParser {

    /**
     * Parses JSON bytes into an object of the given type.
     *
     * @param jsonBytes the UTF-8 encoded JSON document
     * @param valueType the target type
     * @param <T>       the target type
     *
     * @return the decoded object
     *
     * @throws com.eyelevel.textextraction.exception.json.JsonParsingException if the payload cannot be
     *                                                                          decoded
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
