package com.onevault.identity;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HubStore} over a {@link ConcurrentHashMap}. {@code putIfAbsent} is the atomic
 * insert-or-observe primitive, so racing creators never duplicate a hub and never fail.
 */
public final class InMemoryHubStore implements HubStore {

    private final Map<HashKey, HubRecord> hubs = new ConcurrentHashMap<>();

    @Override
    public HubResolution insertIfAbsent(HubRecord candidate) {
        HubRecord existing = hubs.putIfAbsent(candidate.hashKey(), candidate);
        if (existing == null) {
            return new HubResolution(candidate, true);
        }
        return new HubResolution(existing, false);
    }

    @Override
    public Optional<HubRecord> find(HashKey hashKey) {
        return Optional.ofNullable(hubs.get(hashKey));
    }

    @Override
    public int size() {
        return hubs.size();
    }
}
