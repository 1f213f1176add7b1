package com.onevault.versioning;

/**
 * The writing thread was interrupted before the commit point. Nothing was written. The thread's
 * interrupt status is left set.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
