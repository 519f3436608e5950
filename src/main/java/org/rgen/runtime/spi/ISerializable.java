package org.rgen.runtime.spi;

/**
 * Interface for runtime components whose internal state must survive a save/restore cycle.
 * <p>
 * A restored component must continue exactly where the saved one stopped, so the
 * serialized state has to be complete. Implementations use compact binary encodings
 * (e.g., {@link java.nio.ByteBuffer}) and must serialize deterministically.
 * </p>
 */
public interface ISerializable {

    /**
     * Serializes the complete internal state of this component.
     *
     * @return Byte array containing the complete internal state, or an empty array if stateless.
     */
    byte[] saveState();

    /**
     * Restores the internal state of this component from previously saved state.
     *
     * @param state The state bytes previously returned by {@link #saveState()}.
     * @throws IllegalArgumentException if state is null, truncated or incompatible with this component.
     */
    void loadState(byte[] state);
}
