package com.onevault.identity;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed-length binary identifier of a business entity, derived by {@link IdentityResolver}.
 *
 * <p>WHY not a record: a record over {@code byte[]} would compare array references. This class
 * copies the bytes in and out and compares by content, so two independently derived keys for the
 * same entity are equal.
 */
public final class HashKey implements Comparable<HashKey> {

    /** Length of every hash key in bytes (SHA-256 digest size). */
    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private HashKey(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a 32-byte digest.
     *
     * @throws IdentityValidationException if the array is null or not {@value #LENGTH} bytes long
     */
    public static HashKey of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IdentityValidationException(
                    "hash key must be exactly %d bytes".formatted(LENGTH));
        }
        return new HashKey(bytes.clone());
    }

    /**
     * Parses the lowercase or uppercase hex form produced by {@link #toHex()}.
     *
     * @throws IdentityValidationException if the string is not 64 hex characters
     */
    public static HashKey fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IdentityValidationException("hash key hex must be 64 characters");
        }
        try {
            return new HashKey(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IdentityValidationException("hash key hex is not valid hexadecimal: " + hex);
        }
    }

    /** Returns a copy of the raw digest bytes. */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /** Lowercase hex rendering, the form used in logs, audit events and JSON payloads. */
    public String toHex() {
        return HEX.formatHex(bytes);
    }

    /** First eight hex characters, for log lines where the full key is noise. */
    public String shortHex() {
        return toHex().substring(0, 8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof HashKey other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public int compareTo(HashKey other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
