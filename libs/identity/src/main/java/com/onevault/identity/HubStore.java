package com.onevault.identity;

import java.util.Optional;

/**
 * Storage port for hub rows. Implementations must make {@link #insertIfAbsent} atomic per hash
 * key: of any number of concurrent inserts for one key, exactly one wins.
 */
public interface HubStore {

    /**
     * Inserts the hub unless a row with the same hash key exists.
     *
     * @return the row now stored for that key, with {@code created} telling whether it is ours
     */
    HubResolution insertIfAbsent(HubRecord candidate);

    Optional<HubRecord> find(HashKey hashKey);

    /** Number of hub rows, across all tenants. */
    int size();
}
