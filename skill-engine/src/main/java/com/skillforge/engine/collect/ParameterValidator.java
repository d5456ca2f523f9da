package com.skillforge.engine.collect;

import com.skillforge.engine.error.FieldError;
import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.spec.FieldType;
import com.skillforge.engine.spec.ParameterField;
import com.skillforge.engine.spec.ParameterGroup;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates answers against declared parameter fields and coerces them to
 * the declared type. All errors are collected before anything is reported;
 * a group is either accepted whole or not at all.
 */
@Component
public class ParameterValidator {

    /**
     * Validates one group's answers: every required field must be present and
     * no undeclared field may appear.
     *
     * @return the coerced answers in field declaration order
     * @throws ValidationException carrying every field error found
     */
    public Map<String, Object> validateGroup(ParameterGroup group, Map<String, Object> answers,
                                             String operation, String key) {
        Map<String, Object> given = answers == null ? Map.of() : answers;
        List<FieldError> errors = new ArrayList<>();
        Map<String, Object> coerced = new LinkedHashMap<>();

        for (String name : given.keySet()) {
            if (group.field(name) == null) {
                errors.add(new FieldError(name, "not a field of group '" + group.name() + "'"));
            }
        }
        for (ParameterField field : group.fields()) {
            Object value = given.get(field.name());
            if (value == null) {
                if (field.required()) errors.add(new FieldError(field.name(), "is required"));
                continue;
            }
            Object result = coerce(field, value, errors);
            if (result != null) coerced.put(field.name(), result);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(operation, key,
                    errors.size() + " invalid answer(s) for group '" + group.name() + "'", errors);
        }
        return coerced;
    }

    /**
     * Validates only the fields the caller supplied, across all groups.
     * Fields that no group declares pass through untouched; missing fields are
     * left for the execution adapter to report.
     */
    public Map<String, Object> validateProvided(List<ParameterGroup> groups, Map<String, Object> parameters,
                                                String operation, String key) {
        Map<String, Object> out = new LinkedHashMap<>(parameters);
        List<FieldError> errors = new ArrayList<>();
        for (ParameterGroup group : groups) {
            for (ParameterField field : group.fields()) {
                Object value = parameters.get(field.name());
                if (value == null) continue;
                Object result = coerce(field, value, errors);
                if (result != null) out.put(field.name(), result);
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(operation, key, errors.size() + " invalid parameter(s)", errors);
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Coercion and constraints
    // ------------------------------------------------------------------

    /** @return the coerced value, or null after recording an error */
    private static Object coerce(ParameterField field, Object value, List<FieldError> errors) {
        Object typed;
        try {
            typed = toType(field.type(), value);
        } catch (IllegalArgumentException e) {
            errors.add(new FieldError(field.name(), "expected " + field.type().wireName() + " but got '" + value + "'"));
            return null;
        }
        String violation = checkConstraints(field, typed);
        if (violation != null) {
            errors.add(new FieldError(field.name(), violation));
            return null;
        }
        return typed;
    }

    private static Object toType(FieldType type, Object value) {
        return switch (type) {
            case STRING -> {
                if (value instanceof List<?> || value instanceof Map<?, ?>) throw new IllegalArgumentException();
                yield value.toString();
            }
            case INTEGER -> {
                BigDecimal d = decimal(value);
                try {
                    yield d.longValueExact();
                } catch (ArithmeticException e) {
                    throw new IllegalArgumentException("not an integer", e);
                }
            }
            case NUMBER -> decimal(value).doubleValue();
            case BOOLEAN -> {
                if (value instanceof Boolean b) yield b;
                String s = value.toString().strip().toLowerCase(Locale.ROOT);
                if (s.equals("true") || s.equals("yes")) yield true;
                if (s.equals("false") || s.equals("no")) yield false;
                throw new IllegalArgumentException("not a boolean");
            }
            case LIST -> {
                if (value instanceof List<?> list) yield new ArrayList<>(list);
                if (value instanceof String s) {
                    yield s.isBlank() ? List.of() : Arrays.stream(s.split(",")).map(String::strip).toList();
                }
                throw new IllegalArgumentException("not a list");
            }
        };
    }

    private static BigDecimal decimal(Object value) {
        if (value instanceof Boolean || value instanceof List<?> || value instanceof Map<?, ?>) {
            throw new IllegalArgumentException("not a number");
        }
        try {
            return new BigDecimal(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number", e);
        }
    }

    private static String checkConstraints(ParameterField field, Object value) {
        double measure = switch (field.type()) {
            case INTEGER, NUMBER -> ((Number) value).doubleValue();
            case STRING -> ((String) value).length();
            case LIST -> ((List<?>) value).size();
            case BOOLEAN -> Double.NaN;
        };
        String unit = switch (field.type()) {
            case STRING -> " characters";
            case LIST -> " items";
            default -> "";
        };
        if (field.min() != null && measure < field.min()) {
            return "must be at least " + format(field.min()) + unit;
        }
        if (field.max() != null && measure > field.max()) {
            return "must be at most " + format(field.max()) + unit;
        }
        if (field.pattern() != null && value instanceof String s) {
            try {
                if (!Pattern.compile(field.pattern()).matcher(s).matches()) {
                    return "must match pattern " + field.pattern();
                }
            } catch (PatternSyntaxException e) {
                return "declares an invalid pattern " + field.pattern();
            }
        }
        if (!field.choices().isEmpty() && !isChoice(field, value)) {
            return "must be one of " + field.choices();
        }
        return null;
    }

    private static boolean isChoice(ParameterField field, Object value) {
        if (value instanceof List<?> list) {
            return list.stream().allMatch(item -> matchesAnyChoice(field, item));
        }
        return matchesAnyChoice(field, value);
    }

    private static boolean matchesAnyChoice(ParameterField field, Object value) {
        for (Object choice : field.choices()) {
            if (choice instanceof Number c && value instanceof Number v) {
                if (c.doubleValue() == v.doubleValue()) return true;
            } else if (String.valueOf(choice).equals(String.valueOf(value))) {
                return true;
            }
        }
        return false;
    }

    private static String format(double d) {
        return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
    }
}
