package dev.fumaz.ambit.exception;

/**
 * Thrown when the ambient resolution context is read before any binding was established.
 */
public class OutOfContextException extends AmbitException {

    public OutOfContextException(String message) {
        super(message);
    }

    public OutOfContextException(String message, Throwable cause) {
        super(message, cause);
    }

    public OutOfContextException(Throwable cause) {
        super(cause);
    }
}
