package com.fitlog.backend.common.error;

/**
 * Base of every rejection raised by the fitness data services.
 * {@link #code()} is a stable upper-snake identifier; the message is for logs.
 */
public abstract class FitnessDataException extends RuntimeException {

    private final String code;

    protected FitnessDataException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected FitnessDataException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }
}
