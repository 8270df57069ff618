package dev.fumaz.ambit.exception;

/**
 * Indicates an invalid registration or binding detected at runtime.
 */
public class ConfigurationException extends AmbitException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }
}
