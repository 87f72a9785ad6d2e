package org.learningjava.scalarstore.domain.error;

public class MappingFormatException extends ScalarsException {

    public MappingFormatException(String projectId, Throwable cause) {
        super("Stored scalar mapping for project " + projectId + " is unreadable", cause);
    }
}
