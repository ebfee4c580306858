package com.brisk.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One flat evaluation scope: name to value, no parent chain. Functions capture a snapshot of it and
 * calls build a new one; two scopes never share the same mutable map.
 */
public class Environment {

    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {}

    /** Copies {@code initial}; later changes to either side are not shared. */
    public Environment(Map<String, Value> initial) {
        if (initial != null) values.putAll(initial);
    }

    public boolean exists(String name) {
        return values.containsKey(name);
    }

    /** @return the bound value, or null when the name is unbound */
    public Value get(String name) {
        return values.get(name);
    }

    /** Inserts or overwrites. */
    public void assign(String name, Value value) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        if (value == null) throw new IllegalArgumentException("value must not be null for " + name);
        values.put(name, value);
    }

    void assignAll(Map<String, Value> other) {
        for (Map.Entry<String, Value> e : other.entrySet()) assign(e.getKey(), e.getValue());
    }

    public int size() {
        return values.size();
    }

    /** Immutable copy of the current bindings, in insertion order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Environment copy() {
        return new Environment(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
