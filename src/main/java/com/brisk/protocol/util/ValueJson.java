package com.brisk.protocol.util;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.brisk.script.parser.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON view of runtime values and environments.
 *
 * Numbers, null and vectors go both ways. Functions are written as a descriptor
 * ({@code {"type":"function","params":[...]}}) and cannot be read back.
 */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ValueJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                // JSON has no NaN/Infinity
                if (Double.isNaN(d) || Double.isInfinite(d)) return om.getNodeFactory().textNode(Double.toString(d));
                return om.getNodeFactory().numberNode(d);
            }
            case FUNCTION: {
                ObjectNode fn = om.createObjectNode();
                fn.put("type", "function");
                ArrayNode params = fn.putArray("params");
                for (String p : v.asFunction().params) params.add(p);
                return fn;
            }
            case VECTOR: {
                ArrayNode arr = om.createArrayNode();
                for (Value item : v.asVector()) arr.add(toJson(item));
                return arr;
            }
            default:
                return om.getNodeFactory().nullNode();
        }
    }

    /** Object in the map's iteration order. */
    public static ObjectNode toJson(Map<String, Value> env) {
        ObjectNode out = om.createObjectNode();
        for (Map.Entry<String, Value> e : env.entrySet()) {
            out.set(e.getKey(), toJson(e.getValue()));
        }
        return out;
    }

    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull()) return Value.nil();
        if (node.isNumber()) return Value.number(node.asDouble());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.vector(items);
        }
        throw new IllegalArgumentException("ValueJson: unsupported JSON node " + node.getNodeType());
    }

    /** Reads a top-level JSON object into an initial environment. */
    public static Map<String, Value> readEnvironment(String json) throws IOException {
        JsonNode root = om.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("ValueJson: environment must be a JSON object");
        }
        Map<String, Value> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            out.put(e.getKey(), fromJson(e.getValue()));
        }
        return out;
    }

    public static String writeString(JsonNode node) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    }
}
