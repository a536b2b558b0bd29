package org.karo.runtime.spi;

/**
 * State that must survive a checkpoint/restore cycle.
 * <p>
 * Implementations return an opaque byte array from {@link #saveState()} and accept
 * the same bytes in {@link #loadState(byte[])}. Stateless implementations may return
 * an empty array.
 */
public interface ISerializable {

    /**
     * @return the current state as opaque bytes
     */
    byte[] saveState();

    /**
     * Replaces the current state with a previously saved one.
     *
     * @param state bytes produced by {@link #saveState()}
     */
    void loadState(byte[] state);
}
