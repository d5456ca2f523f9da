package com.skillforge.engine.execution;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillforge.engine.error.FieldError;
import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.spec.InputDeclaration;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds caller parameters to an entry point's Java parameters by name.
 *
 * <ul>
 *   <li>A declared input binds its external {@code name} to the Java
 *       parameter {@code param}; undeclared parameters bind by their own name.</li>
 *   <li>An absent input falls back to its declared default, else it is missing.
 *       Every missing input is reported in one {@code MISSING_REQUIRED_INPUT}.</li>
 *   <li>An entry point taking a single {@link Map} that no input names
 *       receives the whole parameter object, merged over the declared defaults.</li>
 * </ul>
 *
 * Values are converted to the parameter's generic type with Jackson.
 */
final class InputMapper {

    private final ObjectMapper json;

    InputMapper(ObjectMapper json) {
        this.json = json;
    }

    Object[] map(String skillId, Method method, List<InputDeclaration> declarations,
                 Map<String, Object> inputs) {
        Parameter[] params = method.getParameters();

        if (takesWholeObject(params, declarations, inputs)) {
            Map<String, Object> merged = new LinkedHashMap<>();
            for (InputDeclaration d : declarations) {
                if (d.hasDefault()) merged.put(d.name(), d.defaultValue());
            }
            merged.putAll(inputs);
            return new Object[] { merged };
        }

        Object[] args = new Object[params.length];
        List<String> missing = new ArrayList<>();
        List<FieldError> unconvertible = new ArrayList<>();

        for (int i = 0; i < params.length; i++) {
            Parameter p = params[i];
            InputDeclaration decl = declarationFor(p.getName(), declarations);
            String external = decl != null ? decl.name() : p.getName();

            Object value;
            if (inputs.containsKey(external)) {
                value = inputs.get(external);
            } else if (decl != null && decl.hasDefault()) {
                value = decl.defaultValue();
            } else {
                missing.add(external);
                continue;
            }

            if (value == null && p.getType().isPrimitive()) {
                unconvertible.add(new FieldError(external, "must not be null"));
                continue;
            }
            try {
                JavaType target = json.getTypeFactory().constructType(p.getParameterizedType());
                args[i] = json.convertValue(value, target);
            } catch (IllegalArgumentException e) {
                unconvertible.add(new FieldError(external,
                        "cannot be converted to " + p.getParameterizedType().getTypeName()));
            }
        }

        if (!missing.isEmpty()) {
            throw new SkillExecutionException(SkillExecutionException.Kind.MISSING_REQUIRED_INPUT, skillId,
                    "missing required input(s) " + missing + " for " + method.getDeclaringClass().getSimpleName()
                            + "." + method.getName());
        }
        if (!unconvertible.isEmpty()) {
            throw new ValidationException("execute", "skill_id=" + skillId,
                    unconvertible.size() + " input(s) have the wrong type", unconvertible);
        }
        return args;
    }

    private static boolean takesWholeObject(Parameter[] params, List<InputDeclaration> declarations,
                                            Map<String, Object> inputs) {
        if (params.length != 1 || !Map.class.isAssignableFrom(params[0].getType())) {
            return false;
        }
        String name = params[0].getName();
        return declarationFor(name, declarations) == null && !inputs.containsKey(name);
    }

    private static InputDeclaration declarationFor(String paramName, List<InputDeclaration> declarations) {
        for (InputDeclaration d : declarations) {
            if (d.param().equals(paramName)) return d;
        }
        return null;
    }
}
