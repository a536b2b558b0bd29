package org.karo.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed key/value store holding the internal state one trait keeps on one particle
 * (age, direction, remaining lifetime and the like).
 * <p>
 * Values are restricted to {@code Integer}, {@code Long}, {@code Double},
 * {@code Boolean} and {@code String} so that checkpoints can reproduce them exactly.
 * Iteration follows insertion order.
 * <p>
 * <b>Thread safety:</b> not thread-safe; a particle's state is only touched by the
 * thread planning that particle.
 */
public final class TraitState implements TraitStateView {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public TraitState() {
    }

    /**
     * Creates a state pre-populated from a map; see {@link #put(String, Object)} for
     * the accepted value types.
     */
    public TraitState(Map<String, ?> initial) {
        initial.forEach(this::put);
    }

    @Override
    public boolean has(String key) {
        return values.containsKey(key);
    }

    @Override
    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        return value instanceof Number n ? n.intValue() : defaultValue;
    }

    @Override
    public long getLong(String key, long defaultValue) {
        Object value = values.get(key);
        return value instanceof Number n ? n.longValue() : defaultValue;
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        return value instanceof Number n ? n.doubleValue() : defaultValue;
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        return value instanceof Boolean b ? b : defaultValue;
    }

    @Override
    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value instanceof String s ? s : defaultValue;
    }

    public TraitState set(String key, int value) {
        values.put(key, value);
        return this;
    }

    public TraitState set(String key, long value) {
        values.put(key, value);
        return this;
    }

    public TraitState set(String key, double value) {
        values.put(key, value);
        return this;
    }

    public TraitState set(String key, boolean value) {
        values.put(key, value);
        return this;
    }

    public TraitState set(String key, String value) {
        values.put(key, value);
        return this;
    }

    /**
     * Stores a value of any supported type. {@code Short} and {@code Byte} are widened
     * to {@code Integer}, {@code Float} to {@code Double}.
     *
     * @throws IllegalArgumentException for null or unsupported values
     */
    public TraitState put(String key, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Double
                || value instanceof Boolean || value instanceof String) {
            values.put(key, value);
        } else if (value instanceof Short || value instanceof Byte) {
            values.put(key, ((Number) value).intValue());
        } else if (value instanceof Float f) {
            values.put(key, f.doubleValue());
        } else {
            throw new IllegalArgumentException("Unsupported trait state value for '" + key + "': " + value);
        }
        return this;
    }

    public void remove(String key) {
        values.remove(key);
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * @return an independent copy; values are immutable so a shallow copy suffices
     */
    public TraitState copy() {
        return new TraitState(values);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TraitState other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
