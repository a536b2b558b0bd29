package org.karo.runtime.resume;

import org.karo.runtime.SimulationException;

/**
 * Thrown when a checkpoint cannot be written, read or restored, for example because
 * it is malformed, of an unknown format version, or refers to traits the supplied
 * rule registry does not define.
 */
public class CheckpointException extends SimulationException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
