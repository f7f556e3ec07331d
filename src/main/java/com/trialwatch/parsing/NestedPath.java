package com.trialwatch.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Tolerant dotted-path access into a registry study tree. Any missing key, or a step through
 * something that is not an object, resolves to {@link MissingNode}; the typed accessors turn
 * that into the caller's default.
 */
public final class NestedPath {

    private NestedPath() {
    }

    public static JsonNode resolve(JsonNode root, String path) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        JsonNode current = root;
        int start = 0;
        while (true) {
            int dot = path.indexOf('.', start);
            String key = dot < 0 ? path.substring(start) : path.substring(start, dot);
            if (!current.isObject()) {
                return MissingNode.getInstance();
            }
            JsonNode next = current.get(key);
            if (next == null) {
                return MissingNode.getInstance();
            }
            current = next;
            if (dot < 0) {
                return current;
            }
            start = dot + 1;
        }
    }

    /**
     * Scalar value as text; null, missing, empty and container nodes yield {@code defaultValue}.
     */
    public static String text(JsonNode root, String path, String defaultValue) {
        return scalarText(resolve(root, path), defaultValue);
    }

    public static Integer integer(JsonNode root, String path) {
        JsonNode node = resolve(root, path);
        if (node.isNumber()) {
            return node.canConvertToExactIntegral() && node.canConvertToInt() ? node.intValue() : null;
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Boolean bool(JsonNode root, String path) {
        JsonNode node = resolve(root, path);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asBoolean();
    }

    /**
     * Scalar elements of an array as text. A lone scalar becomes a one-element list; anything
     * else yields an empty list.
     */
    public static List<String> textList(JsonNode root, String path) {
        JsonNode node = resolve(root, path);
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = scalarText(item, null);
                if (value != null) {
                    out.add(value);
                }
            }
        } else {
            String value = scalarText(node, null);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    static String scalarText(JsonNode node, String defaultValue) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return defaultValue;
        }
        String value = node.asText();
        return value.isEmpty() ? defaultValue : value;
    }
}
