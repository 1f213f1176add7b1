package com.onevault.identity;

/**
 * Thrown when an operation references a hash key or token the core has never seen.
 */
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String reference;

    public NotFoundException(String kind, String reference) {
        super("%s not found: %s".formatted(kind, reference));
        this.kind = kind;
        this.reference = reference;
    }

    /** What was looked up, e.g. "hub" or "session". */
    public String kind() {
        return kind;
    }

    /** The key that was looked up (hex hash key or a redacted token reference). */
    public String reference() {
        return reference;
    }
}
