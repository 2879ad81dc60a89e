// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pfive.rpcgate.exception.CodecException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/// Checks JSON values against the type language of the interface description.
///
/// A type is one of:
/// - a string naming a primitive (string, int, uint, float, money, bool, json, void, hex, base64,
///   uuid, date, datetime) or an entry of the type table. A "?" suffix makes it optional (null or
///   absent allowed) and a "[]" suffix makes it an array of the preceding type.
/// - an object, describing an inline struct whose fields map to types.
/// - an array of strings, describing an enum.
///
/// Struct fields not present in the type are dropped from the result, and absent optional fields
/// appear as explicit nulls. Decoding and encoding apply the same checks; encoding first converts
/// the Java value to a tree.
public class JsonTypeCodec implements ValueCodec {

    private static final Pattern HEX = Pattern.compile("^([0-9a-fA-F]{2})*$");
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final ObjectMapper objectMapper;

    public JsonTypeCodec (ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode decode (JsonNode typeTable, String path, JsonNode type, JsonNode value) {
        return check(typeTable, path, type, value);
    }

    @Override
    public JsonNode encode (JsonNode typeTable, String path, JsonNode type, Object value) {
        final JsonNode tree;
        if (value == null) {
            tree = NullNode.getInstance();
        } else if (value instanceof JsonNode node) {
            tree = node;
        } else {
            try {
                tree = objectMapper.valueToTree(value);
            } catch (IllegalArgumentException e) {
                throw new CodecException(path, "Cannot convert value at '%s' to JSON: %s".formatted(path, e.getMessage()));
            }
        }
        return check(typeTable, path, type, tree);
    }

    /// A null value means the member was absent from its enclosing object.
    private JsonNode check (JsonNode typeTable, String path, JsonNode type, JsonNode value) {
        if (type == null) {
            throw new CodecException(path, "Missing type description at '%s'.".formatted(path));
        }
        if (type.isObject()) {
            return checkStruct(typeTable, path, type, value);
        }
        if (type.isArray()) {
            return checkEnum(path, type, value);
        }
        if (!type.isTextual()) {
            throw new CodecException(path, "Invalid type description at '%s': %s".formatted(path, type));
        }
        String typeName = type.asText();
        if (typeName.endsWith("?")) {
            if (isAbsent(value)) {
                return NullNode.getInstance();
            }
            return check(typeTable, path, textType(typeName.substring(0, typeName.length() - 1)), value);
        }
        if (typeName.endsWith("[]")) {
            return checkArray(typeTable, path, typeName, value);
        }
        return checkNamed(typeTable, path, typeName, value);
    }

    private JsonNode checkStruct (JsonNode typeTable, String path, JsonNode type, JsonNode value) {
        if (value == null || !value.isObject()) {
            throw mismatch(path, "object", value);
        }
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = type.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldPath = path + "." + field.getKey();
            result.set(field.getKey(), check(typeTable, fieldPath, field.getValue(), value.get(field.getKey())));
        }
        return result;
    }

    private JsonNode checkEnum (String path, JsonNode type, JsonNode value) {
        if (value != null && value.isTextual()) {
            for (JsonNode option : type) {
                if (option.asText().equals(value.asText())) {
                    return value;
                }
            }
        }
        throw mismatch(path, "one of " + type, value);
    }

    private JsonNode checkArray (JsonNode typeTable, String path, String typeName, JsonNode value) {
        if (value == null || !value.isArray()) {
            throw mismatch(path, typeName, value);
        }
        JsonNode elementType = textType(typeName.substring(0, typeName.length() - 2));
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < value.size(); i++) {
            result.add(check(typeTable, path + "[" + i + "]", elementType, value.get(i)));
        }
        return result;
    }

    private JsonNode checkNamed (JsonNode typeTable, String path, String typeName, JsonNode value) {
        switch (typeName) {
            case "json":
                if (value == null) throw mismatch(path, typeName, null);
                return value;
            case "void":
                if (isAbsent(value)) return NullNode.getInstance();
                throw mismatch(path, typeName, value);
            case "string":
                if (value != null && value.isTextual()) return value;
                throw mismatch(path, typeName, value);
            case "bool":
                if (value != null && value.isBoolean()) return value;
                throw mismatch(path, typeName, value);
            case "float":
                if (value != null && value.isNumber()) return value;
                throw mismatch(path, typeName, value);
            case "int":
            case "money":
                if (isIntegral(value)) return value;
                throw mismatch(path, typeName, value);
            case "uint":
                if (isIntegral(value) && value.asDouble() >= 0) return value;
                throw mismatch(path, typeName, value);
            case "hex":
                if (matches(value, HEX)) return value;
                throw mismatch(path, typeName, value);
            case "uuid":
                if (matches(value, UUID)) return value;
                throw mismatch(path, typeName, value);
            case "base64":
                if (isBase64(value)) return value;
                throw mismatch(path, typeName, value);
            case "date":
                if (isDate(value)) return value;
                throw mismatch(path, typeName, value);
            case "datetime":
                if (isDateTime(value)) return value;
                throw mismatch(path, typeName, value);
            default:
                JsonNode named = typeTable == null ? null : typeTable.get(typeName);
                if (named == null) {
                    throw new CodecException(path, "Unknown type '%s' at '%s'.".formatted(typeName, path));
                }
                return check(typeTable, path, named, value);
        }
    }

    private static boolean isAbsent (JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    private static boolean isIntegral (JsonNode value) {
        if (value == null || !value.isNumber()) return false;
        if (value.isIntegralNumber()) return true;
        double d = value.asDouble();
        return !Double.isInfinite(d) && d == Math.rint(d);
    }

    private static boolean matches (JsonNode value, Pattern pattern) {
        return value != null && value.isTextual() && pattern.matcher(value.asText()).matches();
    }

    private static boolean isBase64 (JsonNode value) {
        if (value == null || !value.isTextual()) return false;
        try {
            Base64.getDecoder().decode(value.asText());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isDate (JsonNode value) {
        if (value == null || !value.isTextual()) return false;
        try {
            LocalDate.parse(value.asText());
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /// Accepts timestamps with or without an offset, as clients of different generations send both.
    private static boolean isDateTime (JsonNode value) {
        if (value == null || !value.isTextual()) return false;
        try {
            OffsetDateTime.parse(value.asText());
            return true;
        } catch (DateTimeParseException e) {
            try {
                LocalDateTime.parse(value.asText());
                return true;
            } catch (DateTimeParseException e2) {
                return false;
            }
        }
    }

    private static JsonNode textType (String typeName) {
        return JsonNodeFactory.instance.textNode(typeName);
    }

    private static CodecException mismatch (String path, String expected, JsonNode value) {
        String got = value == null ? "undefined" : value.toString();
        return new CodecException(path, "Invalid type at '%s', expected %s, got %s".formatted(path, expected, got));
    }

}
