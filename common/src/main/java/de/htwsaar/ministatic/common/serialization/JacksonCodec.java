package de.htwsaar.ministatic.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Gemeinsamer JSON-Codec für Fehlerbodies und Tests.
 *
 * <p>Ausgabe kompakt und in Deklarationsreihenfolge der Felder; beim Lesen werden
 * unbekannte Felder ignoriert.</p>
 */
public final class JacksonCodec {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JacksonCodec() {
        // Utility
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Cannot write " + typeName(obj) + " as JSON", e);
        }
    }

    /**
     * Serialisiert direkt in UTF-8-Bytes, z. B. für Antwort-Bodies mit exakter Länge.
     */
    public static byte[] toJsonBytes(Object obj) {
        try {
            return MAPPER.writeValueAsBytes(obj);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Cannot write " + typeName(obj) + " as JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Cannot read JSON as [" + clazz.getSimpleName() + "]", e);
        }
    }

    private static String typeName(Object obj) {
        return obj == null ? "null" : obj.getClass().getSimpleName();
    }
}
