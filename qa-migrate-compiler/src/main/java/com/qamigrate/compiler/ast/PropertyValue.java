package com.qamigrate.compiler.ast;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

import java.util.Objects;

/**
 * Scalar value held in a node's property bag: a string, a number, a boolean, or absent.
 */
public final class PropertyValue {

    public enum Kind { STRING, NUMBER, BOOLEAN, ABSENT }

    private static final PropertyValue ABSENT = new PropertyValue(Kind.ABSENT, null);

    private final Kind kind;
    private final Object value;

    private PropertyValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static PropertyValue of(String value) {
        return value == null ? ABSENT : new PropertyValue(Kind.STRING, value);
    }

    public static PropertyValue of(Number value) {
        return value == null ? ABSENT : new PropertyValue(Kind.NUMBER, value);
    }

    public static PropertyValue of(boolean value) {
        return new PropertyValue(Kind.BOOLEAN, value);
    }

    public static PropertyValue absent() {
        return ABSENT;
    }

    public Kind kind() { return kind; }

    public boolean isAbsent() { return kind == Kind.ABSENT; }

    /** String form for STRING values, {@code null} otherwise. */
    public String asString() {
        return kind == Kind.STRING ? (String) value : null;
    }

    public Number asNumber() {
        return kind == Kind.NUMBER ? (Number) value : null;
    }

    public Boolean asBoolean() {
        return kind == Kind.BOOLEAN ? (Boolean) value : null;
    }

    /** Textual rendering of any non-absent value; used for literal step parameters. */
    public String asText() {
        return value == null ? null : String.valueOf(value);
    }

    public JsonElement toJson() {
        return switch (kind) {
            case STRING -> new JsonPrimitive((String) value);
            case NUMBER -> new JsonPrimitive((Number) value);
            case BOOLEAN -> new JsonPrimitive((Boolean) value);
            case ABSENT -> JsonNull.INSTANCE;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyValue)) return false;
        PropertyValue other = (PropertyValue) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, value); }

    @Override
    public String toString() {
        return kind == Kind.ABSENT ? "<absent>" : String.valueOf(value);
    }
}
