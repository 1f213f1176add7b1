package com.onevault.versioning;

import com.onevault.identity.HashKey;
import java.time.Duration;

/** The store could not serve the write in time. Retry with backoff. */
public class StoreUnavailableException extends RuntimeException {

    private final HashKey hashKey;

    public StoreUnavailableException(HashKey hashKey, Duration waited) {
        super("Store unavailable for %s: lock not acquired within %d ms"
                .formatted(hashKey.shortHex(), waited.toMillis()));
        this.hashKey = hashKey;
    }

    public HashKey hashKey() {
        return hashKey;
    }
}
