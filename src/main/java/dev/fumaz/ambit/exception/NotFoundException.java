package dev.fumaz.ambit.exception;

/**
 * Thrown when an identifier has no binding registered for it.
 */
public class NotFoundException extends ConfigurationException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public NotFoundException(Throwable cause) {
        super(cause);
    }
}
