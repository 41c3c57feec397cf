package org.carball.designer.config;

/**
 * Raised when cost model or statistics settings cannot be used, before any cost is computed.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
