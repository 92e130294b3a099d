package com.astrophot.exception;

public class PhotometryException extends RuntimeException {
    public PhotometryException(String message) {
        super(message);
    }

    public PhotometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
