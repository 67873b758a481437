package id.go.kemenkeu.djpbn.sakti.wf.core.field;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowInternalException;

import java.nio.charset.StandardCharsets;
import java.sql.Clob;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON text column <-> {@code Map<String, Object>}.
 */
public class StructuredFieldCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public StructuredFieldCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        ensureJsr310Module(objectMapper);
    }

    public StructuredFieldCodec() {
        this(new ObjectMapper());
    }

    /**
     * Decode a raw column value. {@code null} and blank text decode to an empty map.
     */
    public Map<String, Object> readMap(Object raw) {
        String json = asText(raw);
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> value = objectMapper.readValue(json, MAP_TYPE);
            return value != null ? value : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new ValidationException("Stored structured field is not a JSON object", e);
        }
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Value cannot be encoded as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private static String asText(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String) {
            return (String) raw;
        }
        if (raw instanceof byte[]) {
            return new String((byte[]) raw, StandardCharsets.UTF_8);
        }
        if (raw instanceof Clob) {
            Clob clob = (Clob) raw;
            try {
                return clob.getSubString(1, (int) clob.length());
            } catch (SQLException e) {
                throw new WorkflowInternalException("Failed to read structured field", e);
            }
        }
        return raw.toString();
    }

    private static void ensureJsr310Module(ObjectMapper mapper) {
        boolean hasModule = mapper.getRegisteredModuleIds().stream()
            .anyMatch(id -> id.toString().contains("jsr310") || id.toString().contains("JavaTimeModule"));
        if (!hasModule) {
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
    }
}
