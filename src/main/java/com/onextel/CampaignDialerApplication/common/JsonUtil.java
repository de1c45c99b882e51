package com.onextel.CampaignDialerApplication.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * Static JSON helpers for code paths that run outside Spring wiring (queue workers, log entries).
 * Dates are written as ISO-8601 strings.
 */
@Slf4j
public final class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonUtil() {
    }

    public static <T> String serialize(T obj) throws JsonProcessingException {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", obj == null ? "null" : obj.getClass().getSimpleName(), e);
            throw e;
        }
    }
}
