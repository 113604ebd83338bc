package com.compass.evidencecollector.common.json.jackson;

import com.compass.evidencecollector.common.json.JsonParser;
import com.compass.evidencecollector.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        if (json == null) {
            throw new JsonParsingException("Cannot parse a null JSON string", null);
        }
        try {
            T result = objectMapper.readValue(json, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (JsonProcessingException e) {
            log.debug("Error parsing JSON string to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }
}
