package com.phillippitts.structurecoach.exception;

/**
 * Thrown by an external generative-text collaborator (quality judge, interview scorer) when
 * it is disabled, unreachable, or returns output that cannot be used. Callers fall back to
 * deterministic heuristics.
 */
public class CollaboratorUnavailableException extends StructureCoachException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super(collaborator + " unavailable: " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(collaborator + " unavailable: " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
