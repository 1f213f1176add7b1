package com.onevault.versioning.link;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.onevault.identity.HashKey;
import com.onevault.identity.IdentityValidationException;
import com.onevault.identity.MutationRecord;
import com.onevault.identity.RecordFamily;
import com.onevault.identity.testing.TestIdentities;
import com.onevault.versioning.InMemoryVersionStore;
import com.onevault.versioning.LoadDateClock;
import com.onevault.versioning.PayloadCodec;
import com.onevault.versioning.Version;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryLinkStore")
class InMemoryLinkStoreTest {

    private TestIdentities ids;
    private InMemoryLinkStore links;
    private HashKey user;
    private HashKey role;

    @BeforeEach
    void setUp() {
        ids = TestIdentities.defaultTenant();
        var loadDates = new LoadDateClock(ids.clock());
        links = new InMemoryLinkStore(loadDates, new InMemoryVersionStore(loadDates));
        user = ids.hub("alice@example.com");
        role = ids.hub("acme-health | administrator");
    }

    @Nested
    @DisplayName("link()")
    class Link {

        @Test
        @DisplayName("is idempotent for the same ordered participants")
        void idempotent() {
            LinkRecord first = links.link(user, role, "auth");
            LinkRecord second = links.link(user, role, "auth");

            assertThat(second).isEqualTo(first);
            assertThat(links.linksOf(user)).containsExactly(first);
        }

        @Test
        @DisplayName("order matters: (a, b) and (b, a) are different links")
        void ordered() {
            LinkRecord forward = links.link(user, role, "auth");
            LinkRecord backward = links.link(role, user, "auth");

            assertThat(forward.linkKey()).isNotEqualTo(backward.linkKey());
        }

        @Test
        @DisplayName("links three participants")
        void nAry() {
            HashKey session = ids.hub("session-1");
            LinkRecord link = links.link(List.of(user, role, session), "auth");

            assertThat(link.participants()).containsExactly(user, role, session);
            assertThat(links.linksOf(session)).containsExactly(link);
            assertThat(links.find(link.linkKey())).contains(link);
            assertThat(links.linkKeyOf(List.of(user, role, session))).isEqualTo(link.linkKey());
        }

        @Test
        @DisplayName("rejects fewer than two participants")
        void tooFew() {
            assertThatThrownBy(() -> links.link(List.of(user), "auth"))
                    .isInstanceOf(IdentityValidationException.class);
        }

        @Test
        @DisplayName("notifies listeners once per new link")
        void notifies() {
            List<MutationRecord> seen = new ArrayList<>();
            links.addListener(seen::add);
            links.link(user, role, "auth");
            links.link(user, role, "auth");

            assertThat(seen).singleElement()
                    .satisfies(m -> assertThat(m.family()).isEqualTo(RecordFamily.LINK));
        }

        @Test
        @DisplayName("concurrent callers get one link record")
        void concurrent() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<LinkRecord>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return links.link(user, role, "auth");
                    }));
                }
                start.countDown();
                Set<LinkRecord> results = new HashSet<>();
                for (Future<LinkRecord> future : futures) {
                    results.add(future.get(10, TimeUnit.SECONDS));
                }
                assertThat(results).hasSize(1);
            } finally {
                pool.shutdownNow();
            }
            assertThat(links.linksOf(user)).hasSize(1);
        }
    }

    @Test
    @DisplayName("link attributes are versioned under the link key")
    void versionedAttributes() {
        LinkRecord link = links.link(user, role, "auth");

        links.attributes().put(link.linkKey(), PayloadCodec.encode(Map.of("scope", "read")), "auth");
        Version current = links.attributes().put(
                link.linkKey(), PayloadCodec.encode(Map.of("scope", "write")), "auth");

        assertThat(links.attributes().history(link.linkKey())).hasSize(2);
        assertThat(PayloadCodec.decode(current, Map.class)).containsEntry("scope", "write");
    }
}
