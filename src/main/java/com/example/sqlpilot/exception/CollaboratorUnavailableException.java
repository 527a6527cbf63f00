package com.example.sqlpilot.exception;

/**
 * The database or the language model cannot be reached. Aborts the whole request.
 */
public class CollaboratorUnavailableException extends SqlPilotException {

    public enum Collaborator {
        DATABASE,
        LANGUAGE_MODEL
    }

    private final Collaborator collaborator;

    public CollaboratorUnavailableException(Collaborator collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(Collaborator collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public Collaborator getCollaborator() {
        return collaborator;
    }
}
