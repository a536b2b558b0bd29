package org.karo.runtime.model;

import java.util.Map;
import java.util.Set;

/**
 * Read-only access to the trait-private state of a particle.
 */
public interface TraitStateView {

    boolean has(String key);

    int getInt(String key, int defaultValue);

    long getLong(String key, long defaultValue);

    double getDouble(String key, double defaultValue);

    boolean getBoolean(String key, boolean defaultValue);

    String getString(String key, String defaultValue);

    /**
     * @return keys in insertion order
     */
    Set<String> keys();

    /**
     * @return an unmodifiable view of the raw values, in insertion order
     */
    Map<String, Object> asMap();
}
