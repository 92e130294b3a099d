package com.astrophot.exception;

public class InsufficientCoverageException extends PhotometryException {

    private final int usableFrames;

    public InsufficientCoverageException(int usableFrames, int required) {
        super("Solo " + usableFrames + " frames utilizables (mínimo " + required + ")");
        this.usableFrames = usableFrames;
    }

    public int getUsableFrames() {
        return usableFrames;
    }
}
