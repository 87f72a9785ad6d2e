package org.learningjava.scalarstore.domain.error;

/**
 * Base class for failures raised by the scalar engine.
 */
public class ScalarsException extends RuntimeException {

    public ScalarsException(String message) {
        super(message);
    }

    public ScalarsException(String message, Throwable cause) {
        super(message, cause);
    }
}
