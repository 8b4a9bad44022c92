package com.opspos.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes replay payloads and audit details into text columns.
 *
 * <p>Dates are ISO-8601 strings and map keys are sorted, so two snapshots of the same check
 * serialize identically and an operator can read a stuck replay item as-is.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);

    private static final ObjectMapper PAYLOAD_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private JsonHelper() {}

    /** Null in, null out. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return PAYLOAD_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} payload", value.getClass().getSimpleName(), e);
            throw new IllegalArgumentException("Payload of type " + value.getClass().getName() + " is not serializable", e);
        }
    }
}
