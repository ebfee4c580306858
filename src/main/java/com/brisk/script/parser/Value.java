package com.brisk.script.parser;

import java.util.List;
import java.util.Objects;

/**
 * Runtime value. Immutable once built, so copies may share their payload.
 */
public final class Value {
    public enum Type { NUMBER, FUNCTION, VECTOR, NULL }

    private static final Value NULL = new Value(Type.NULL, null);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value function(Closure c) { return new Value(Type.FUNCTION, Objects.requireNonNull(c, "closure")); }
    /** No syntax produces vectors yet; hosts may still pass them in. */
    public static Value vector(List<Value> items) { return new Value(Type.VECTOR, List.copyOf(items)); }
    public static Value nil() { return NULL; }

    public Type getType() { return type; }

    public boolean isNumber() { return type == Type.NUMBER; }
    public boolean isFunction() { return type == Type.FUNCTION; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public Closure asFunction() {
        if (type != Type.FUNCTION) throw new IllegalStateException("Expected function, got " + type);
        return (Closure) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asVector() {
        if (type != Type.VECTOR) throw new IllegalStateException("Expected vector, got " + type);
        return (List<Value>) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return Double.toString(asNumber());
            case FUNCTION:
                return "fn(" + String.join(", ", asFunction().params) + ")";
            case VECTOR:
                return asVector().toString();
            default:
                return "null";
        }
    }
}
