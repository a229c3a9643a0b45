package com.example.shield.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks a JSON document and collects every string leaf keyed by its
 * dot-notation path (array elements as {@code items[2]}).
 */
@Slf4j
public final class JsonStringCollector {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_DEPTH = 32;

    private JsonStringCollector() {
    }

    /**
     * @return path to value map, or an empty map when the body is absent or not JSON
     */
    public static Map<String, String> collect(byte[] bodyBytes) {
        Map<String, String> values = new LinkedHashMap<>();
        if (bodyBytes == null || bodyBytes.length == 0) {
            return values;
        }
        try {
            JsonNode root = objectMapper.readTree(new String(bodyBytes, StandardCharsets.UTF_8));
            walk(root, "", values, 0);
        } catch (Exception e) {
            log.debug("Body is not parseable JSON, skipping field scan: {}", e.getMessage());
        }
        return values;
    }

    private static void walk(JsonNode node, String path, Map<String, String> values, int depth) {
        if (node == null || depth > MAX_DEPTH) {
            return;
        }
        if (node.isTextual()) {
            values.put(path.isEmpty() ? "$" : path, node.asText());
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String child = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                walk(field.getValue(), child, values, depth + 1);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                walk(node.get(i), path + "[" + i + "]", values, depth + 1);
            }
        }
    }
}
