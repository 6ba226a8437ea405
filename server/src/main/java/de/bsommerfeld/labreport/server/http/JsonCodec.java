package de.bsommerfeld.labreport.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.error.ValidationException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Wire format of the REST API and the realtime channel. Property names are
 * {@code snake_case}, timestamps ISO-8601 strings. Unknown request
 * properties are ignored.
 */
@Singleton
public class JsonCodec {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * @throws ValidationException if the body is empty or not valid JSON for
     *                             {@code type}
     */
    public <T> T read(byte[] body, Class<T> type) {
        if (body == null || body.length == 0)
            throw new ValidationException("No data provided");
        try {
            T value = mapper.readValue(body, type);
            if (value == null)
                throw new ValidationException("No data provided");
            return value;
        } catch (IOException e) {
            throw new ValidationException("Malformed JSON body", e);
        }
    }

    /**
     * @throws ValidationException if the text is not valid JSON
     */
    public JsonNode readTree(String text) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON message", e);
        }
    }

    public byte[] writeBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public String writeString(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
