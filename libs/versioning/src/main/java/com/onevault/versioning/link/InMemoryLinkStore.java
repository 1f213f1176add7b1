package com.onevault.versioning.link;

import com.onevault.identity.HashKey;
import com.onevault.identity.IdentityValidationException;
import com.onevault.identity.MutationListener;
import com.onevault.identity.MutationRecord;
import com.onevault.identity.RecordFamily;
import com.onevault.versioning.LoadDateClock;
import com.onevault.versioning.VersionStore;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LinkStore} held in memory. Atomic per link key through
 * {@link ConcurrentMap#putIfAbsent}.
 */
public final class InMemoryLinkStore implements LinkStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLinkStore.class);

    private final ConcurrentMap<HashKey, LinkRecord> links = new ConcurrentHashMap<>();
    private final ConcurrentMap<HashKey, Set<HashKey>> byParticipant = new ConcurrentHashMap<>();
    private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();
    private final LoadDateClock loadDates;
    private final VersionStore attributes;

    public InMemoryLinkStore(LoadDateClock loadDates, VersionStore attributes) {
        this.loadDates = Objects.requireNonNull(loadDates, "loadDates");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    @Override
    public LinkRecord link(HashKey first, HashKey second, String recordSource) {
        return link(List.of(requireKey(first), requireKey(second)), recordSource);
    }

    @Override
    public LinkRecord link(List<HashKey> participants, String recordSource) {
        if (recordSource == null || recordSource.isBlank()) {
            throw new IdentityValidationException("recordSource must not be null or blank");
        }
        HashKey linkKey = linkKeyOf(participants);

        LinkRecord existing = links.get(linkKey);
        if (existing != null) {
            return existing;
        }

        // index first so linksOf never misses a published link
        for (HashKey participant : participants) {
            byParticipant.computeIfAbsent(participant, k -> ConcurrentHashMap.newKeySet()).add(linkKey);
        }
        var candidate = new LinkRecord(linkKey, participants, loadDates.next(), recordSource);
        existing = links.putIfAbsent(linkKey, candidate);
        if (existing != null) {
            return existing;
        }

        log.debug("Linked {} participants as {}", participants.size(), linkKey.shortHex());
        notifyCreated(candidate);
        return candidate;
    }

    @Override
    public Optional<LinkRecord> find(HashKey linkKey) {
        return Optional.ofNullable(links.get(linkKey));
    }

    @Override
    public List<LinkRecord> linksOf(HashKey hashKey) {
        Set<HashKey> keys = byParticipant.get(hashKey);
        if (keys == null) {
            return List.of();
        }
        return keys.stream().map(links::get).filter(Objects::nonNull).toList();
    }

    @Override
    public HashKey linkKeyOf(List<HashKey> participants) {
        if (participants == null || participants.size() < 2) {
            throw new IdentityValidationException("a link needs at least two participants");
        }
        MessageDigest digest = sha256();
        for (HashKey participant : participants) {
            digest.update(requireKey(participant).toBytes());
        }
        return HashKey.of(digest.digest());
    }

    @Override
    public VersionStore attributes() {
        return attributes;
    }

    @Override
    public void addListener(MutationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void notifyCreated(LinkRecord link) {
        var mutation = new MutationRecord(
                link.loadDate(), RecordFamily.LINK, link.linkKey(), link.linkKey().toHex(), link.recordSource());
        for (MutationListener listener : listeners) {
            try {
                listener.onMutation(mutation);
            } catch (RuntimeException e) {
                log.warn("Mutation listener failed for link {}", link.linkKey().shortHex(), e);
            }
        }
    }

    private static HashKey requireKey(HashKey key) {
        if (key == null) {
            throw new IdentityValidationException("link participant must not be null");
        }
        return key;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
