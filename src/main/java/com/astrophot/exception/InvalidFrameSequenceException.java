package com.astrophot.exception;

public class InvalidFrameSequenceException extends PhotometryException {
    public InvalidFrameSequenceException(String message) {
        super(message);
    }
}
