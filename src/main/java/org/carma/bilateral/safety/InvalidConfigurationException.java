package org.carma.bilateral.safety;

/**
 * Thrown at construction time when a learner, grid or mechanism is given
 * parameters it cannot run with: a non-positive horizon or grid resolution,
 * or an expert set too small to derive a learning rate.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
