/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable record shape. Field names are unique and may not collide with the
 * reserved timestamp key.
 */
public record Schema(List<FieldSpec> fields) {

    /** Key under which every record carries its generation timestamp. */
    public static final String TIMESTAMP_KEY = "datetime";

    public Schema {
        if (fields == null || fields.isEmpty()) {
            throw new ConfigException("data_description must declare at least one field");
        }
        final Set<String> seen = new HashSet<>();
        for (FieldSpec f : fields) {
            if (f == null) {
                throw new ConfigException("data_description must not contain null fields");
            }
            if (TIMESTAMP_KEY.equals(f.name())) {
                throw new ConfigException("Field name '" + TIMESTAMP_KEY + "' is reserved for the generation timestamp");
            }
            if (!seen.add(f.name())) {
                throw new ConfigException("Duplicate field name '" + f.name() + "' in data_description");
            }
        }
        fields = List.copyOf(fields);
    }

    public static Schema of(FieldSpec... fields) {
        return new Schema(List.of(fields));
    }

    public List<String> fieldNames() {
        final List<String> names = new ArrayList<>(fields.size());
        for (FieldSpec f : fields) names.add(f.name());
        return names;
    }

    public int size() {
        return fields.size();
    }
}
