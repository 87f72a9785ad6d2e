package org.learningjava.scalarstore.domain.error;

/**
 * The storage engine could not be reached or did not answer in time. Callers may retry;
 * the engine itself never does.
 */
public class BackendUnavailableException extends ScalarsException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
