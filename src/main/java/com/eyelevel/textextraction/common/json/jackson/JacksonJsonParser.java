package com.eyelevel.textextraction.common.json.jackson;

import com.eyelevel.textextraction.common.json.JsonParser;
import com.eyelevel.textextraction.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Empty JSON payload for " + valueType.getSimpleName(), null);
        }
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsed JSON into {}: {}", valueType.getSimpleName(), result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON into {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
