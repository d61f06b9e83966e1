package com.project.sketch.scoring.exceptions;

/** Domain-specific exception for scoring errors. */
public class ScoringException extends RuntimeException {
    public ScoringException(String message) { super(message); }
    public ScoringException(String message, Throwable cause) { super(message, cause); }
}
