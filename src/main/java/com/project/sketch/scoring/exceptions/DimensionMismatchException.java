package com.project.sketch.scoring.exceptions;

/** Two buffers of one comparison differ in size. Indicates a normalization bug. */
public class DimensionMismatchException extends ScoringException {
    public DimensionMismatchException(String message) { super(message); }
    public DimensionMismatchException(String message, Throwable cause) { super(message, cause); }
}
