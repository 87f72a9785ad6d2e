package org.learningjava.scalarstore.domain.error;

/**
 * A derived table or column identifier failed validation. Not retryable.
 */
public class InvalidIdentifierException extends ScalarsException {

    private final String identifier;

    public InvalidIdentifierException(String identifier) {
        super("Invalid identifier: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
