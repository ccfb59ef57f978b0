package org.janelia.spatialnorm.common;

/**
 * Exception thrown if something goes wrong during a normalization job.
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ComputationException(Throwable cause) {
        super(cause);
    }

}
