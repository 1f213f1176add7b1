package com.onevault.identity;

/**
 * Outcome of {@link IdentityResolver#ensureHub}.
 *
 * @param hub     the hub row, either freshly inserted or the one another caller created first
 * @param created true only for the caller whose insert won
 */
public record HubResolution(HubRecord hub, boolean created) {

    /** Shortcut for {@code hub().hashKey()}. */
    public HashKey hashKey() {
        return hub.hashKey();
    }
}
