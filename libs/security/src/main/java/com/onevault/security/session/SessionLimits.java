package com.onevault.security.session;

/**
 * Usage caps for one session. Reaching either cap exhausts the session.
 *
 * @param maxRequests requests allowed over the session's life
 * @param maxBytes    data volume allowed over the session's life
 */
public record SessionLimits(long maxRequests, long maxBytes) {

    public SessionLimits {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be >= 1");
        }
    }

    public static SessionLimits unlimited() {
        return new SessionLimits(Long.MAX_VALUE, Long.MAX_VALUE);
    }

    public static SessionLimits ofMegabytes(long maxRequests, long maxMegabytes) {
        return new SessionLimits(maxRequests, Math.multiplyExact(maxMegabytes, 1024L * 1024L));
    }

    public boolean reachedBy(long requestsMade, long bytesMoved) {
        return requestsMade >= maxRequests || bytesMoved >= maxBytes;
    }
}
