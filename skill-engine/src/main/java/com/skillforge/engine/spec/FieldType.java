package com.skillforge.engine.spec;

import java.util.Locale;

public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    LIST;

    /** Accepts the lowercase names used in SKILL.md plus a few common aliases. */
    public static FieldType fromWire(String value) {
        if (value == null || value.isBlank()) return STRING;
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "string", "str", "text"             -> STRING;
            case "integer", "int", "long"            -> INTEGER;
            case "number", "float", "double", "decimal" -> NUMBER;
            case "boolean", "bool"                   -> BOOLEAN;
            case "list", "array"                     -> LIST;
            default -> throw new IllegalArgumentException("unknown field type '" + value + "'");
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
