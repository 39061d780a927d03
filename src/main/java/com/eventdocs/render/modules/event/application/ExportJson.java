package com.eventdocs.render.modules.event.application;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.eventdocs.render.global.error.ProblemException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Accessors for the export's JSON tree.
 */
final class ExportJson {

    private ExportJson() {
    }

    record Entry(int id, JsonNode node) {
    }

    static JsonNode require(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            throw new ProblemException("MISSING_KEY", "Export entry is missing '" + key + "'");
        }
        return node;
    }

    static String text(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        return node == null || node.isNull() ? null : node.asText();
    }

    static String text(JsonNode parent, String key, String fallbackKey) {
        String value = text(parent, key);
        return value != null ? value : text(parent, fallbackKey);
    }

    static int requireInt(JsonNode parent, String key) {
        JsonNode node = require(parent, key);
        if (!node.canConvertToInt() && !node.isTextual()) {
            throw new ProblemException("MALFORMED_VALUE", "'" + key + "' is not an integer");
        }
        return node.isTextual() ? parseId(node.textValue()) : node.intValue();
    }

    static int intOrDefault(JsonNode parent, String key, int defaultValue) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        return node.isTextual() ? parseId(node.textValue()) : node.intValue();
    }

    /**
     * @return the referenced id, or {@code null} when the reference is empty
     */
    static Integer optionalId(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? parseId(node.textValue()) : Integer.valueOf(node.intValue());
    }

    static boolean flag(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        return node != null && node.asBoolean(false);
    }

    /**
     * Entries of an object keyed by string-encoded ids, in document order.
     */
    static List<Entry> entries(JsonNode collection) {
        List<Entry> result = new ArrayList<>();
        if (collection == null || !collection.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> iterator = collection.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            result.add(new Entry(parseId(entry.getKey()), entry.getValue()));
        }
        return result;
    }

    static int parseId(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new ProblemException("MALFORMED_VALUE", "Invalid id '" + value + "'", ex);
        }
    }
}
