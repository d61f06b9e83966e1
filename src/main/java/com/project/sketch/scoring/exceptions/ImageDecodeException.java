package com.project.sketch.scoring.exceptions;

/** Raised when uploaded bytes are not a readable raster image. No partial score is produced. */
public class ImageDecodeException extends ScoringException {
    public ImageDecodeException(String message) { super(message); }
    public ImageDecodeException(String message, Throwable cause) { super(message, cause); }
}
