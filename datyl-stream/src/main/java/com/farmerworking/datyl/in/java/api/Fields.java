package com.farmerworking.datyl.in.java.api;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * The value part of a whitespace-delimited text record: nothing, a single
 * field, or two or more fields in line order.
 */
public final class Fields {
    public enum Kind {
        EMPTY,
        SCALAR,
        SEQUENCE
    }

    private static final Fields EMPTY = new Fields(Kind.EMPTY, ImmutableList.of());

    private final Kind kind;
    private final List<String> values;

    private Fields(Kind kind, List<String> values) {
        this.kind = kind;
        this.values = values;
    }

    public static Fields empty() {
        return EMPTY;
    }

    public static Fields scalar(String value) {
        Preconditions.checkNotNull(value);
        return new Fields(Kind.SCALAR, ImmutableList.of(value));
    }

    public static Fields sequence(List<String> values) {
        Preconditions.checkArgument(values.size() >= 2, "a sequence holds at least two fields, got %s", values.size());
        return new Fields(Kind.SEQUENCE, ImmutableList.copyOf(values));
    }

    // Choose the variant by the number of fields remaining after the key.
    public static Fields of(List<String> remaining) {
        switch (remaining.size()) {
            case 0:
                return empty();
            case 1:
                return scalar(remaining.get(0));
            default:
                return sequence(remaining);
        }
    }

    public Kind kind() {
        return kind;
    }

    // REQUIRES: kind() == SCALAR
    public String scalar() {
        Preconditions.checkState(kind == Kind.SCALAR, "not a scalar: %s", this);
        return values.get(0);
    }

    public List<String> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fields fields = (Fields) o;
        return kind == fields.kind && values.equals(fields.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, values);
    }

    @Override
    public String toString() {
        switch (kind) {
            case EMPTY:
                return "-";
            case SCALAR:
                return values.get(0);
            default:
                return values.toString();
        }
    }
}
