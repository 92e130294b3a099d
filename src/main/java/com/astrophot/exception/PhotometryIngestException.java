package com.astrophot.exception;

public class PhotometryIngestException extends PhotometryException {
    public PhotometryIngestException(String message) {
        super(message);
    }

    public PhotometryIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
