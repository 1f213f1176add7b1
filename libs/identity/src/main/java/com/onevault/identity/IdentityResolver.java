package com.onevault.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives deterministic hash keys and records hub rows.
 *
 * <p>WHY hashing instead of sequences: entities are created independently in every tenant and by
 * every service. Any caller can re-derive an entity's key from (tenant, business key) without a
 * lookup or a central sequence generator.
 *
 * <p>Derivation: {@code SHA-256(tenantKey bytes || UTF-8 businessKey)}. The tenant key is always
 * {@value HashKey#LENGTH} bytes, so the concatenation cannot be ambiguous and two tenants can never
 * produce the same key for the same business key.
 *
 * <p>Thread-safe. {@link #resolve} is pure; {@link #ensureHub} delegates atomicity to the
 * {@link HubStore}.
 */
public final class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    /** Separator for composite business keys, e.g. {@code "acme | administrator"}. */
    public static final String COMPOSITE_SEPARATOR = " | ";

    private final HubStore hubStore;
    private final Clock clock;
    private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();

    public IdentityResolver(HubStore hubStore, Clock clock) {
        if (hubStore == null) {
            throw new IllegalArgumentException("hubStore must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.hubStore = hubStore;
        this.clock = clock;
    }

    /** Registers a listener notified once per newly created hub. */
    public void addListener(MutationListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    /**
     * Derives the root-scope key of a tenant from its business key (e.g. the tenant name).
     *
     * @throws IdentityValidationException if the tenant business key is null or blank
     */
    public HashKey tenantKey(String tenantBusinessKey) {
        requireText(tenantBusinessKey, "tenantBusinessKey");
        return HashKey.of(sha256(tenantBusinessKey.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Derives the hash key of a business entity within a tenant. Pure and side-effect free.
     *
     * @throws IdentityValidationException if the tenant key is null or the business key is blank
     */
    public HashKey resolve(HashKey tenantKey, String businessKey) {
        if (tenantKey == null) {
            throw new IdentityValidationException("tenantKey must not be null");
        }
        requireText(businessKey, "businessKey");
        byte[] tenant = tenantKey.toBytes();
        byte[] business = businessKey.getBytes(StandardCharsets.UTF_8);
        byte[] input = new byte[tenant.length + business.length];
        System.arraycopy(tenant, 0, input, 0, tenant.length);
        System.arraycopy(business, 0, input, tenant.length, business.length);
        return HashKey.of(sha256(input));
    }

    /**
     * Joins business key parts with {@value #COMPOSITE_SEPARATOR}, e.g. tenant name plus role name.
     *
     * @throws IdentityValidationException if no parts are given or any part is blank
     */
    public static String compositeKey(String... parts) {
        if (parts == null || parts.length == 0) {
            throw new IdentityValidationException("composite key needs at least one part");
        }
        for (String part : parts) {
            requireText(part, "composite key part");
        }
        return String.join(COMPOSITE_SEPARATOR, parts);
    }

    /**
     * Records the hub for (tenant, business key) unless it already exists.
     *
     * <p>Safe under concurrent callers: exactly one sees {@code created == true}, every other caller
     * gets the winner's row back.
     */
    public HubResolution ensureHub(HashKey tenantKey, String businessKey, String recordSource) {
        requireText(recordSource, "recordSource");
        HashKey hashKey = resolve(tenantKey, businessKey);

        Optional<HubRecord> existing = hubStore.find(hashKey);
        if (existing.isPresent()) {
            return new HubResolution(existing.get(), false);
        }

        HubRecord candidate = new HubRecord(hashKey, businessKey, tenantKey, now(), recordSource);
        HubResolution resolution = hubStore.insertIfAbsent(candidate);
        if (resolution.created()) {
            log.debug("Created hub {} in tenant {}", hashKey.shortHex(), tenantKey.shortHex());
            notifyCreated(resolution.hub());
        }
        return resolution;
    }

    /**
     * Records the tenant's own hub, whose hash key is also its tenant key.
     */
    public HubResolution ensureTenant(String tenantBusinessKey, String recordSource) {
        requireText(recordSource, "recordSource");
        HashKey tenantKey = tenantKey(tenantBusinessKey);
        HubRecord candidate = new HubRecord(tenantKey, tenantBusinessKey, tenantKey, now(), recordSource);
        HubResolution resolution = hubStore.insertIfAbsent(candidate);
        if (resolution.created()) {
            log.info("Registered tenant {}", tenantKey.shortHex());
            notifyCreated(resolution.hub());
        }
        return resolution;
    }

    /** Looks up a hub by hash key. */
    public Optional<HubRecord> find(HashKey hashKey) {
        return hubStore.find(hashKey);
    }

    /**
     * Looks up a hub that must exist.
     *
     * @throws NotFoundException if no hub has that key
     */
    public HubRecord require(HashKey hashKey) {
        return hubStore.find(hashKey)
                .orElseThrow(() -> new NotFoundException("hub", hashKey.toHex()));
    }

    /**
     * True only if the business key has a hub owned by the given tenant. Used to verify that a
     * resource named in a request belongs to the caller's tenant before acting on it.
     */
    public boolean belongsToTenant(HashKey tenantKey, String businessKey) {
        HashKey hashKey = resolve(tenantKey, businessKey);
        return hubStore.find(hashKey)
                .map(hub -> hub.tenantKey().equals(tenantKey))
                .orElse(false);
    }

    private void notifyCreated(HubRecord hub) {
        var mutation = new MutationRecord(
                hub.loadDate(), RecordFamily.HUB, hub.hashKey(), hub.hashKey().toHex(), hub.recordSource());
        for (MutationListener listener : listeners) {
            try {
                listener.onMutation(mutation);
            } catch (RuntimeException e) {
                log.warn("Mutation listener failed for hub {}", hub.hashKey().shortHex(), e);
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Checks a business key or record source up front, for callers that validate before they know
     * the tenant.
     *
     * @throws IdentityValidationException if the value is null or blank
     */
    public static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IdentityValidationException(name + " must not be null or blank");
        }
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
