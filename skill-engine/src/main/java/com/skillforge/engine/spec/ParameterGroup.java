package com.skillforge.engine.spec;

import java.util.List;

/** An ordered group of fields prompted for in a single collection round. */
public record ParameterGroup(String name, String prompt, List<ParameterField> fields) {

    public ParameterGroup {
        fields = List.copyOf(fields);
    }

    public ParameterField field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst().orElse(null);
    }
}
