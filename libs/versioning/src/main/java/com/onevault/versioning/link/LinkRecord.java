package com.onevault.versioning.link;

import com.onevault.identity.HashKey;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable association between two or more hubs.
 *
 * @param linkKey      SHA-256 over the ordered participant keys
 * @param participants hub keys in the order they were linked
 * @param loadDate     when the association was first recorded
 * @param recordSource provenance tag
 */
public record LinkRecord(HashKey linkKey, List<HashKey> participants, Instant loadDate, String recordSource) {

    public LinkRecord {
        Objects.requireNonNull(linkKey, "linkKey");
        Objects.requireNonNull(loadDate, "loadDate");
        Objects.requireNonNull(recordSource, "recordSource");
        participants = List.copyOf(participants);
    }

    public boolean involves(HashKey hashKey) {
        return participants.contains(hashKey);
    }
}
