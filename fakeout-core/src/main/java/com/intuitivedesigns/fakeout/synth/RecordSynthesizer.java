/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.fakeout.synth;

import com.intuitivedesigns.fakeout.config.FieldSpec;
import com.intuitivedesigns.fakeout.config.Schema;
import com.intuitivedesigns.fakeout.core.SyntheticRecord;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Generates records from a {@link Schema}.
 *
 * <p><b>Threading:</b> not thread-safe. Each pipeline owns one instance (and therefore its
 * own random stream); instances are never shared across pipelines.</p>
 *
 * <p>For every record and every field, in schema order: a uniform draw against
 * {@code proportion_nulls} decides null; otherwise a value is drawn uniformly from the
 * field's domain. Each record is stamped with its own {@link Clock} instant.</p>
 */
public final class RecordSynthesizer {

    private static final long UNIT_STEPS = 1L << 53;

    private final SplittableRandom random;
    private final Clock clock;

    public RecordSynthesizer(Clock clock) {
        this(clock, new SplittableRandom());
    }

    /**
     * Deterministic variant: the same seed and schema produce the same values.
     */
    public RecordSynthesizer(Clock clock, long seed) {
        this(clock, new SplittableRandom(seed));
    }

    private RecordSynthesizer(Clock clock, SplittableRandom random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = random;
    }

    /**
     * @return exactly {@code count} records in generation order
     * @throws SynthesisException if a value cannot be produced for a validated schema
     */
    public List<SyntheticRecord> generate(Schema schema, int count) {
        Objects.requireNonNull(schema, "schema");
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);

        final List<SyntheticRecord> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            try {
                out.add(generateOne(schema));
            } catch (SynthesisException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SynthesisException("Cannot generate record " + i + " of " + count, e);
            }
        }
        return out;
    }

    private SyntheticRecord generateOne(Schema schema) {
        final Map<String, Object> values = new LinkedHashMap<>(schema.size() * 2);
        for (FieldSpec field : schema.fields()) {
            try {
                values.put(field.name(), nextValue(field));
            } catch (RuntimeException e) {
                throw new SynthesisException("Cannot generate value for field '" + field.name() + "' (" + field.dataType().id() + ")", e);
            }
        }
        return new SyntheticRecord(clock.instant(), values);
    }

    private Object nextValue(FieldSpec field) {
        // nextDouble() is in [0,1): 0 never nulls, 1 always nulls
        if (random.nextDouble() < field.proportionNulls()) {
            return null;
        }

        switch (field.dataType()) {
            case CATEGORY: {
                final List<Object> choices = field.allowableValues();
                return choices.get(random.nextInt(choices.size()));
            }
            case FLOAT: {
                final double min = (Double) field.lower();
                final double max = (Double) field.upper();
                return nextDoubleInclusive(min, max);
            }
            case INTEGER:
                return nextLongInclusive((Long) field.lower(), (Long) field.upper());
            case BOOL:
                return random.nextBoolean();
            case DATE: {
                final long min = ((LocalDate) field.lower()).toEpochDay();
                final long max = ((LocalDate) field.upper()).toEpochDay();
                return LocalDate.ofEpochDay(nextLongInclusive(min, max));
            }
            case DATETIME: {
                final long min = ((LocalDateTime) field.lower()).toEpochSecond(ZoneOffset.UTC);
                final long max = ((LocalDateTime) field.upper()).toEpochSecond(ZoneOffset.UTC);
                return LocalDateTime.ofEpochSecond(nextLongInclusive(min, max), 0, ZoneOffset.UTC);
            }
            default:
                throw new IllegalStateException("Unhandled data type " + field.dataType());
        }
    }

    /** Uniform over {@code [min, max]} on a 2^53 grid, both ends reachable. */
    private double nextDoubleInclusive(double min, double max) {
        if (min == max) return min;
        final double u = random.nextLong(UNIT_STEPS + 1) / (double) UNIT_STEPS;
        return Math.min(max, min + u * (max - min));
    }

    private long nextLongInclusive(long min, long max) {
        if (min == max) return min;
        if (max < Long.MAX_VALUE) return random.nextLong(min, max + 1);
        if (min > Long.MIN_VALUE) return random.nextLong(min - 1, max) + 1;
        return random.nextLong();
    }
}
