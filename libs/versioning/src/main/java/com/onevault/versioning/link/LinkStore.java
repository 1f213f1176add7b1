package com.onevault.versioning.link;

import com.onevault.identity.HashKey;
import com.onevault.identity.MutationListener;
import com.onevault.versioning.VersionStore;
import java.util.List;
import java.util.Optional;

/**
 * Relationship store. Links are idempotent: linking the same participants in the same order
 * returns the existing record.
 */
public interface LinkStore {

    /** Links two hubs, e.g. user to role. */
    LinkRecord link(HashKey first, HashKey second, String recordSource);

    /** Links two or more hubs. Order matters: (a, b) and (b, a) are different links. */
    LinkRecord link(List<HashKey> participants, String recordSource);

    Optional<LinkRecord> find(HashKey linkKey);

    /** Every link the hub takes part in, in no particular order. */
    List<LinkRecord> linksOf(HashKey hashKey);

    /** Key a link would get, without recording it. */
    HashKey linkKeyOf(List<HashKey> participants);

    /** Satellite store for link attributes, keyed by link hash key. */
    VersionStore attributes();

    void addListener(MutationListener listener);
}
