package com.skillforge.engine.spec;

/**
 * A declared entry-point input.
 *
 * {@code name} is the caller-facing parameter name; {@code param} is the Java
 * parameter of the entry point it binds to (same as {@code name} unless
 * renamed). {@code hasDefault} distinguishes "no default" from a declared
 * null default.
 */
public record InputDeclaration(
        String  name,
        String  param,
        String  type,
        boolean hasDefault,
        Object  defaultValue
) {
    public InputDeclaration {
        if (param == null || param.isBlank()) {
            param = name;
        }
    }
}
