/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.config;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One named, typed field of a {@link Schema}.
 *
 * <p>The compact constructor validates the shape of {@code allowableValues} against the
 * data type and normalizes it:</p>
 * <ul>
 * <li>category: the discrete values, unchanged;</li>
 * <li>float: {@code [Double min, Double max]};</li>
 * <li>integer: {@code [Long min, Long max]};</li>
 * <li>date: {@code [LocalDate min, LocalDate max]};</li>
 * <li>datetime: {@code [LocalDateTime min, LocalDateTime max]};</li>
 * <li>bool: empty.</li>
 * </ul>
 *
 * @param name            field name, unique within its schema
 * @param dataType        value type
 * @param allowableValues normalized domain (see above)
 * @param proportionNulls probability in [0,1] that the field is emitted as null
 */
public record FieldSpec(String name, DataType dataType, List<Object> allowableValues, double proportionNulls) {

    /** Accepts {@code 2023-01-01 00:00:00} as well as ISO {@code 2023-01-01T00:00:00}. */
    public static final DateTimeFormatter DATETIME_INPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd[' ']['T']HH:mm:ss");

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new ConfigException("Field name must not be blank");
        }
        name = name.trim();
        Objects.requireNonNull(dataType, "dataType");

        if (Double.isNaN(proportionNulls) || proportionNulls < 0.0 || proportionNulls > 1.0) {
            throw new ConfigException("Field '" + name + "': proportion_nulls must be within [0,1], got " + proportionNulls);
        }

        final List<Object> raw = (allowableValues == null) ? List.of() : allowableValues;
        allowableValues = normalize(name, dataType, raw);
    }

    public static FieldSpec of(String name, DataType dataType, List<?> allowableValues) {
        return new FieldSpec(name, dataType, allowableValues == null ? null : new ArrayList<>(allowableValues), 0.0);
    }

    public FieldSpec withProportionNulls(double proportion) {
        return new FieldSpec(name, dataType, allowableValues, proportion);
    }

    public Object lower() {
        return allowableValues.get(0);
    }

    public Object upper() {
        return allowableValues.get(1);
    }

    // --- Validation ---

    private static List<Object> normalize(String field, DataType type, List<Object> raw) {
        switch (type) {
            case CATEGORY: {
                if (raw.isEmpty()) {
                    throw new ConfigException("Field '" + field + "': category requires at least one allowable value");
                }
                for (Object v : raw) {
                    if (v == null) {
                        throw new ConfigException("Field '" + field + "': category values must not be null");
                    }
                }
                return Collections.unmodifiableList(new ArrayList<>(raw));
            }
            case BOOL: {
                if (!raw.isEmpty()) {
                    throw new ConfigException("Field '" + field + "': bool takes no allowable values");
                }
                return List.of();
            }
            case FLOAT: {
                requirePair(field, type, raw);
                final double min = toDouble(field, raw.get(0));
                final double max = toDouble(field, raw.get(1));
                if (!Double.isFinite(min) || !Double.isFinite(max)) {
                    throw new ConfigException("Field '" + field + "': float bounds must be finite, got [" + min + ", " + max + "]");
                }
                requireOrdered(field, Double.compare(min, max));
                if (!Double.isFinite(max - min)) {
                    throw new ConfigException("Field '" + field + "': float range [" + min + ", " + max + "] is too wide");
                }
                return List.of(min, max);
            }
            case INTEGER: {
                requirePair(field, type, raw);
                final long min = toLong(field, raw.get(0));
                final long max = toLong(field, raw.get(1));
                requireOrdered(field, Long.compare(min, max));
                return List.of(min, max);
            }
            case DATE: {
                requirePair(field, type, raw);
                final LocalDate min = toDate(field, raw.get(0));
                final LocalDate max = toDate(field, raw.get(1));
                requireOrdered(field, min.compareTo(max));
                return List.of(min, max);
            }
            case DATETIME: {
                requirePair(field, type, raw);
                final LocalDateTime min = toDateTime(field, raw.get(0));
                final LocalDateTime max = toDateTime(field, raw.get(1));
                requireOrdered(field, min.compareTo(max));
                return List.of(min, max);
            }
            default:
                throw new ConfigException("Field '" + field + "': unsupported data_type " + type);
        }
    }

    private static void requirePair(String field, DataType type, List<Object> raw) {
        if (raw.size() != 2 || raw.get(0) == null || raw.get(1) == null) {
            throw new ConfigException("Field '" + field + "': " + type.id() + " requires allowable_values [min, max], got " + raw);
        }
    }

    private static void requireOrdered(String field, int cmp) {
        if (cmp > 0) {
            throw new ConfigException("Field '" + field + "': allowable_values min must not exceed max");
        }
    }

    private static double toDouble(String field, Object v) {
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Field '" + field + "': '" + v + "' is not a number");
        }
    }

    private static long toLong(String field, Object v) {
        try {
            final BigDecimal d = (v instanceof Number n) ? new BigDecimal(n.toString()) : new BigDecimal(String.valueOf(v).trim());
            return d.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigException("Field '" + field + "': '" + v + "' is not an integer");
        }
    }

    private static LocalDate toDate(String field, Object v) {
        if (v instanceof LocalDate d) return d;
        try {
            return LocalDate.parse(String.valueOf(v).trim());
        } catch (DateTimeParseException e) {
            throw new ConfigException("Field '" + field + "': '" + v + "' is not a date (yyyy-MM-dd)");
        }
    }

    private static LocalDateTime toDateTime(String field, Object v) {
        if (v instanceof LocalDateTime dt) return dt;
        try {
            return LocalDateTime.parse(String.valueOf(v).trim(), DATETIME_INPUT);
        } catch (DateTimeParseException e) {
            throw new ConfigException("Field '" + field + "': '" + v + "' is not a datetime (yyyy-MM-dd HH:mm:ss)");
        }
    }
}
