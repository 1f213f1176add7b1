package com.onevault.audit;

/** A sink could not accept an audit record. */
public class AuditDeliveryException extends RuntimeException {

    public AuditDeliveryException(String message) {
        super(message);
    }

    public AuditDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
