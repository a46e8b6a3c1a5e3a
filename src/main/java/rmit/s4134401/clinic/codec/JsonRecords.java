package rmit.s4134401.clinic.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Shared Jackson setup for records. Decimals stay exact so service prices survive a round trip. */
public final class JsonRecords {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private JsonRecords(){}

    public static ObjectMapper mapper(){ return MAPPER; }

    public static ObjectNode newRecord(){ return MAPPER.createObjectNode(); }

    /** Null when the key is absent or holds JSON null. */
    static String text(JsonNode record, String key){
        JsonNode n = record.get(key);
        return n == null || n.isNull() ? null : n.asText();
    }

    /** {@code fallback} only when the key is absent; an explicit null stays null. */
    static String textOr(JsonNode record, String key, String fallback){
        return record.has(key) ? text(record, key) : fallback;
    }

    static Integer integer(JsonNode record, String key){
        JsonNode n = record.get(key);
        if (n == null || n.isNull()) return null;
        if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
        if (n.isTextual()) {
            try {
                return Integer.valueOf(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' is not an integer: " + n.asText(), e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' is not an integer: " + n);
    }
}
