package dev.fumaz.ambit.exception;

/**
 * Base unchecked exception for Ambit-specific failures.
 */
public class AmbitException extends RuntimeException {

    public AmbitException(String message) {
        super(message);
    }

    public AmbitException(String message, Throwable cause) {
        super(message, cause);
    }

    public AmbitException(Throwable cause) {
        super(cause);
    }
}
