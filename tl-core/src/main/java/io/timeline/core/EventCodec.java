package io.timeline.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of an {@link Event}: {@code {"id":..,"type":..,"data":{..},"schemaVersion":..}}.
 *
 * Reading is lenient about older records: {@code data} may arrive as a JSON-encoded string and the
 * version may be stored under {@code version} or as a number.
 */
public final class EventCodec {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper json;

    public EventCodec(ObjectMapper json) { this.json = Objects.requireNonNull(json); }

    public EventCodec() { this(new ObjectMapper()); }

    public ObjectMapper mapper() { return json; }

    public String encode(Event e) {
        ObjectNode node = json.createObjectNode();
        node.put("id", e.id().format());
        node.put("type", e.type());
        node.set("data", json.valueToTree(e.data()));
        node.put("schemaVersion", e.schemaVersion());
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot encode event " + e.id(), ex);
        }
    }

    public Event decode(String record) {
        JsonNode node;
        try {
            node = json.readTree(record);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unreadable event record", ex);
        }
        if (node == null || !node.isObject()) throw new IllegalArgumentException("Event record is not a JSON object");
        var id = node.get("id");
        var type = node.get("type");
        if (id == null || !id.isTextual()) throw new MalformedIdentifierException(String.valueOf(id), "missing id");
        if (type == null || !type.isTextual()) throw new IllegalArgumentException("Event record has no type");
        return new Event(Hlc.parse(id.asText()), type.asText(), decodeData(node.get("data")), decodeVersion(node));
    }

    /** Payload column value for relational storage. */
    public String encodeData(Map<String, Object> data) {
        try {
            return json.writeValueAsString(data);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot encode event data", ex);
        }
    }

    public Map<String, Object> decodeData(String raw) {
        if (raw == null) return Map.of();
        return decodeData(json.getNodeFactory().textNode(raw));
    }

    private Map<String, Object> decodeData(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) return Map.of();
        if (data.isObject()) return json.convertValue(data, MAP);
        if (data.isTextual()) {
            try {
                var parsed = json.readTree(data.asText());
                if (parsed != null && parsed.isObject()) return json.convertValue(parsed, MAP);
            } catch (JsonProcessingException ignored) {
                // plain string payload, kept as-is below
            }
        }
        var wrapped = new LinkedHashMap<String, Object>();
        wrapped.put("value", json.convertValue(data, Object.class));
        return wrapped;
    }

    private static String decodeVersion(JsonNode node) {
        var v = node.has("schemaVersion") ? node.get("schemaVersion") : node.get("version");
        if (v == null || v.isNull()) return Event.DEFAULT_SCHEMA_VERSION;
        if (v.isTextual() || v.isNumber()) return v.asText();
        return Event.DEFAULT_SCHEMA_VERSION;
    }
}
