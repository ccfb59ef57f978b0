package org.janelia.spatialnorm.exceptions;

import org.janelia.spatialnorm.common.ComputationException;

/**
 * The job was configured with a combination of inputs that cannot be processed,
 * for example a non binary image where a binary mask is required. Never retried.
 */
public class ConfigurationException extends ComputationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable e) {
        super(message, e);
    }
}
