package com.skillforge.engine.execution;

import com.skillforge.engine.spec.OutputAdapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a declared output adapter to a normalized raw result.
 *
 * Source paths are dot-separated; a numeric segment indexes into a list and
 * {@code $} selects the whole raw result. A path that does not resolve is an
 * authoring defect in the skill and fails the call.
 */
final class OutputAdapterTransform {

    private static final String WHOLE_RESULT = "$";

    private OutputAdapterTransform() {}

    static Object apply(OutputAdapter adapter, Object raw, String skillId) {
        if (adapter == null) return raw;
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> m : adapter.mappings().entrySet()) {
            out.put(m.getKey(), resolve(raw, m.getValue(), m.getKey(), skillId));
        }
        return out;
    }

    private static Object resolve(Object raw, String path, String target, String skillId) {
        if (WHOLE_RESULT.equals(path)) return raw;
        Object current = raw;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map && map.containsKey(segment)) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment, list.size())) {
                current = list.get(Integer.parseInt(segment));
            } else {
                throw new SkillExecutionException(SkillExecutionException.Kind.OUTPUT_ADAPTER_MISMATCH, skillId,
                        "output adapter maps '" + target + "' from '" + path
                                + "' but the raw result has no '" + segment + "'");
            }
        }
        return current;
    }

    private static boolean isIndex(String segment, int size) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit) || segment.length() > 9) {
            return false;
        }
        return Integer.parseInt(segment) < size;
    }
}
