package org.karo.runtime.spi;

/**
 * Called once when a particle leaves the simulation, after it has been taken off
 * the track and before it is dropped from the registry.
 * <p>
 * Handlers may queue replacement particles through {@link RemovalContext#spawn}.
 * Traits are scanned in attachment order until one handler reports that it handled
 * the removal.
 */
@FunctionalInterface
public interface IRemovalHandler {

    /**
     * @param context The removed particle and the reason for its removal
     * @return true if this handler took care of the removal, false to continue scanning
     */
    boolean onRemoval(RemovalContext context);
}
