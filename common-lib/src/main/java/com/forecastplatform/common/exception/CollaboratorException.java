package com.forecastplatform.common.exception;

/**
 * The research or probability-synthesis collaborator failed, timed out or returned nothing.
 */
public class CollaboratorException extends NodeProcessingException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super("[" + collaborator + "] " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super("[" + collaborator + "] " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
