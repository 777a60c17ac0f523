package com.mk.fx.qa.load.traffic.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.util.List;

/** Shared Jackson mapper for request and response payloads. */
public final class JsonUtil {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final ObjectMapper MAPPER =
            JsonMapper.builder()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .build();

    private JsonUtil() {
        throw new UnsupportedOperationException("JsonUtil cannot be instantiated");
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * Decodes a JSON array of strings.
     *
     * @throws JsonProcessingException if the payload is not a JSON array of strings
     */
    public static List<String> toStringList(byte[] json) throws JsonProcessingException {
        try {
            List<String> values = MAPPER.readValue(json, STRING_LIST);
            return values != null ? values : List.of();
        } catch (JsonProcessingException e) {
            throw e;
        } catch (IOException e) {
            throw new IllegalStateException("Unexpected I/O error decoding in-memory JSON", e);
        }
    }
}
