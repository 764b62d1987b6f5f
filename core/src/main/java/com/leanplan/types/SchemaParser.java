package com.leanplan.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses type and shape strings into {@link StructType} and {@link Shape} objects.
 *
 * <p>Record formats accepted by {@link #parse(String)}:
 * <ul>
 *   <li>Brace records: {@code {name: string, amount: int32}}</li>
 *   <li>DDL structs: {@code struct<id:int,name:string>}</li>
 *   <li>Bare field lists: {@code id:int, name:string}</li>
 *   <li>JSON: {@code {"type":"struct","fields":[{"name":"id","type":"integer"},...]}}</li>
 * </ul>
 *
 * <p>Shapes accepted by {@link #parseShape(String)} prefix a measure with dimensions:
 * {@code var * {a: int32}}, {@code 10 * {a: int32}}, or no dimension at all ({@code float64}).
 */
public class SchemaParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Map<String, DataType> ELEMENT_TYPES = new HashMap<>();

    static {
        for (DataType type : List.of(BooleanType.get(), IntegerType.get(), LongType.get(),
                FloatType.get(), DoubleType.get(), StringType.get(), DateType.get(), TimestampType.get())) {
            for (String alias : type.aliases()) {
                ELEMENT_TYPES.put(alias, type);
            }
        }
    }

    private SchemaParser() {
    }

    /**
     * Parses a record type string.
     *
     * <p>A shape string ({@code var * {...}}) is accepted too; its dimension is dropped.
     *
     * @param schemaStr the record type string
     * @return the parsed StructType
     * @throws IllegalArgumentException if the string is invalid
     */
    public static StructType parse(String schemaStr) {
        if (schemaStr == null || schemaStr.isEmpty()) {
            throw new IllegalArgumentException("Schema string cannot be null or empty");
        }

        String trimmed = schemaStr.trim();

        if (isJson(trimmed)) {
            return parseJsonSchema(trimmed);
        }
        if (findTopLevel(trimmed, '*') >= 0) {
            return parseShape(trimmed).schema();
        }
        if (trimmed.startsWith("{") || trimmed.toLowerCase().startsWith("struct<")) {
            return (StructType) parseType(trimmed);
        }
        // Bare field list: "a:int, b:string"
        return parseStructFields(trimmed);
    }

    /**
     * Parses a shape string such as {@code var * {a: int32}}.
     *
     * @param shapeStr the shape string
     * @return the parsed Shape
     * @throws IllegalArgumentException if the string is invalid or has more than one dimension
     */
    public static Shape parseShape(String shapeStr) {
        if (shapeStr == null || shapeStr.isEmpty()) {
            throw new IllegalArgumentException("Shape string cannot be null or empty");
        }

        String trimmed = shapeStr.trim();
        int star = findTopLevel(trimmed, '*');
        if (star < 0) {
            return Shape.scalar(isJson(trimmed) ? parseJsonSchema(trimmed) : parseType(trimmed));
        }

        String dimStr = trimmed.substring(0, star).trim();
        String measureStr = trimmed.substring(star + 1).trim();
        if (findTopLevel(measureStr, '*') >= 0) {
            throw new IllegalArgumentException("Only one dimension is supported: " + shapeStr);
        }
        DataType measure = isJson(measureStr) ? parseJsonSchema(measureStr) : parseType(measureStr);
        return new Shape(parseDimension(dimStr), measure);
    }

    private static Dimension parseDimension(String dimStr) {
        if (dimStr.equalsIgnoreCase("var")) {
            return Dimension.VAR;
        }
        try {
            return Dimension.fixed(Long.parseLong(dimStr));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid dimension: " + dimStr, e);
        }
    }

    private static boolean isJson(String str) {
        if (!str.startsWith("{")) {
            return false;
        }
        String rest = str.substring(1).trim();
        return rest.startsWith("\"");
    }

    /**
     * Parses a JSON schema string into a StructType.
     *
     * <p>Expected format:
     * <pre>
     * {
     *   "type": "struct",
     *   "fields": [
     *     {"name": "id", "type": "integer"},
     *     {"name": "name", "type": "string"}
     *   ]
     * }
     * </pre>
     */
    private static StructType parseJsonSchema(String jsonStr) {
        try {
            JsonNode root = objectMapper.readTree(jsonStr);
            return parseJsonStructType(root);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON schema: " + e.getMessage(), e);
        }
    }

    private static StructType parseJsonStructType(JsonNode node) {
        JsonNode fieldsNode = node.get("fields");
        if (fieldsNode == null || !fieldsNode.isArray()) {
            return StructType.EMPTY;
        }

        List<StructField> fields = new ArrayList<>();
        for (JsonNode fieldNode : fieldsNode) {
            String name = fieldNode.get("name").asText();
            fields.add(new StructField(name, parseJsonDataType(fieldNode.get("type"))));
        }
        return new StructType(fields);
    }

    private static DataType parseJsonDataType(JsonNode typeNode) {
        if (typeNode == null) {
            throw new IllegalArgumentException("Type node cannot be null");
        }
        if (typeNode.isTextual()) {
            return parsePrimitiveType(typeNode.asText().toLowerCase());
        }
        if (typeNode.isObject()) {
            String typeName = typeNode.get("type").asText().toLowerCase();
            if (typeName.equals("struct")) {
                return parseJsonStructType(typeNode);
            }
            return parsePrimitiveType(typeName);
        }
        throw new IllegalArgumentException("Unsupported type node: " + typeNode);
    }

    /**
     * Parses the inner content of a record (field definitions).
     *
     * @param fieldsStr the comma-separated field definitions
     * @return the parsed StructType
     */
    private static StructType parseStructFields(String fieldsStr) {
        if (fieldsStr.isEmpty()) {
            return StructType.EMPTY;
        }

        List<StructField> fields = new ArrayList<>();
        for (String fieldDef : splitTopLevel(fieldsStr, ',')) {
            fields.add(parseField(fieldDef.trim()));
        }
        return new StructType(fields);
    }

    private static StructField parseField(String fieldDef) {
        int colonIndex = fieldDef.indexOf(':');
        if (colonIndex == -1) {
            throw new IllegalArgumentException("Invalid field definition: " + fieldDef);
        }

        String name = unquote(fieldDef.substring(0, colonIndex).trim());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Missing field name: " + fieldDef);
        }
        return new StructField(name, parseType(fieldDef.substring(colonIndex + 1).trim()));
    }

    private static String unquote(String name) {
        if (name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);
            if ((first == '\'' || first == '"' || first == '`') && first == last) {
                return name.substring(1, name.length() - 1);
            }
        }
        return name;
    }

    /**
     * Parses a type string into a DataType. Nested records are supported in both
     * {@code {...}} and {@code struct<...>} spelling.
     */
    private static DataType parseType(String typeStr) {
        String normalized = typeStr.toLowerCase().trim();

        if (normalized.startsWith("{") && normalized.endsWith("}")) {
            return parseStructFields(typeStr.trim().substring(1, typeStr.trim().length() - 1).trim());
        }
        if (normalized.startsWith("struct<") && normalized.endsWith(">")) {
            return parseStructFields(typeStr.trim().substring(7, typeStr.trim().length() - 1).trim());
        }
        return parsePrimitiveType(normalized);
    }

    /**
     * Parses an element type name.
     *
     * @param typeStr the normalized type string (lowercase)
     * @return the DataType
     */
    private static DataType parsePrimitiveType(String typeStr) {
        DataType type = ELEMENT_TYPES.get(typeStr);
        if (type != null) {
            return type;
        }
        if (typeStr.startsWith("decimal") || typeStr.startsWith("numeric")) {
            return parseDecimalType(typeStr);
        }
        throw new UnsupportedOperationException("Unsupported type: " + typeStr);
    }

    private static DecimalType parseDecimalType(String typeStr) {
        int start = typeStr.indexOf('(');
        int end = typeStr.indexOf(')');
        if (start == -1 || end == -1) {
            return new DecimalType(10, 0);
        }

        String[] parts = typeStr.substring(start + 1, end).split(",");
        try {
            int precision = Integer.parseInt(parts[0].trim());
            int scale = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0;
            return new DecimalType(precision, scale);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid decimal type: " + typeStr, e);
        }
    }

    /**
     * Splits a string by a delimiter, respecting nested brackets.
     */
    private static List<String> splitTopLevel(String str, char delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;

        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '<' || c == '(' || c == '{') {
                depth++;
            } else if (c == '>' || c == ')' || c == '}') {
                depth--;
            } else if (c == delimiter && depth == 0) {
                String part = str.substring(start, i).trim();
                if (!part.isEmpty()) {
                    parts.add(part);
                }
                start = i + 1;
            }
        }

        if (start < str.length()) {
            String part = str.substring(start).trim();
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    /**
     * Finds the first top-level occurrence of a character (ignoring nested brackets).
     *
     * @return the index, or -1 if not found
     */
    private static int findTopLevel(String str, char target) {
        int depth = 0;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '<' || c == '(' || c == '{') {
                depth++;
            } else if (c == '>' || c == ')' || c == '}') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
