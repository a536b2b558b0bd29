package org.karo.runtime;

/**
 * Thrown when trait or rule registration is contradictory or incomplete.
 * <p>
 * Always raised during setup (registry construction, particle registration or
 * configuration loading), before any step executes.
 */
public class ConfigurationException extends SimulationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
