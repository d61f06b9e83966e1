package com.project.sketch.scoring.exceptions;

/**
 * The reference image could not be located. Scoring recovers from this by comparing the
 * submission against itself.
 */
public class MissingReferenceException extends ScoringException {
    public MissingReferenceException(String message) { super(message); }
    public MissingReferenceException(String message, Throwable cause) { super(message, cause); }
}
