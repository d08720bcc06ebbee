package io.skillagent.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

/**
 * Shared JSON mapper and small helpers.
 */
public final class Utils {

    /**
     * Mapper used for every wire conversion. Dates are written as ISO-8601 strings and unknown
     * properties are ignored so newer clients can talk to older servers.
     */
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Utils() {
    }

    /**
     * Copies a metadata map, keeping {@code null} values that JSON payloads may carry.
     *
     * @param map the map, may be null
     * @return an unmodifiable copy, or null
     */
    public static @Nullable Map<String, Object> copyOfNullable(@Nullable Map<String, Object> map) {
        return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }

    /**
     * Serializes a value with {@link #OBJECT_MAPPER}.
     *
     * @param value the value
     * @return the JSON text
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
