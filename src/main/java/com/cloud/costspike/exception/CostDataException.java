package com.cloud.costspike.exception;

/**
 * Base type for input the detection pipeline cannot work with.
 * These are never retried: the same payload fails the same way every time.
 */
public abstract class CostDataException extends RuntimeException {

    protected CostDataException(String message) {
        super(message);
    }

    protected CostDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
