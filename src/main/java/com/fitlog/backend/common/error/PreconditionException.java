package com.fitlog.backend.common.error;

/**
 * A composite operation was called with an input combination it cannot run with.
 */
public class PreconditionException extends FitnessDataException {

    public static final String CODE = "PRECONDITION_FAILED";

    private final String reason;

    public PreconditionException(String reason) {
        super(CODE, reason);
        this.reason = reason;
    }

    /** e.g. USER_NOT_FOUND, EXERCISES_REQUIRED */
    public String reason() { return reason; }
}
